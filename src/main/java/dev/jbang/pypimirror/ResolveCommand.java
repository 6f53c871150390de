package dev.jbang.pypimirror;

import dev.jbang.pypimirror.model.SnapshotPath;
import dev.jbang.pypimirror.scraper.SnapshotConfig;
import dev.jbang.pypimirror.scraper.TransferResolver;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/** Resolve command printing the download URL of snapshot paths */
@Command(
		name = "resolve",
		description = "Print the download URL of each snapshot path (read from standard input if none are given)",
		mixinStandardHelpOptions = true)
public class ResolveCommand implements Callable<Integer> {

	@Spec
	CommandSpec spec;

	@Option(
			names = {"--package-base"},
			description = "Base URL of package files (default: ${DEFAULT-VALUE})",
			defaultValue = SnapshotConfig.DEFAULT_PACKAGE_BASE)
	private String packageBase;

	@Parameters(arity = "0..*", paramLabel = "PATH", description = "Snapshot paths relative to the package base")
	private List<String> paths;

	@Override
	public Integer call() throws Exception {
		TransferResolver resolver = new TransferResolver(packageBase);
		PrintWriter out = spec.commandLine().getOut();
		if (paths != null && !paths.isEmpty()) {
			for (String path : paths) {
				out.println(resolver.resolve(new SnapshotPath(path)));
			}
		} else {
			try (BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
				String line;
				while ((line = reader.readLine()) != null) {
					if (!line.isBlank()) {
						out.println(resolver.resolve(new SnapshotPath(line.trim())));
					}
				}
			}
		}
		out.flush();
		return 0;
	}
}
