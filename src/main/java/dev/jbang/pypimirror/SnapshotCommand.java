package dev.jbang.pypimirror;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.jbang.pypimirror.discovery.BigQueryExecutor;
import dev.jbang.pypimirror.discovery.DiscoveryException;
import dev.jbang.pypimirror.discovery.DiscoveryMode;
import dev.jbang.pypimirror.model.RetentionBudget;
import dev.jbang.pypimirror.model.SnapshotPath;
import dev.jbang.pypimirror.reporting.ProgressReporter;
import dev.jbang.pypimirror.scraper.PypiSnapshot;
import dev.jbang.pypimirror.scraper.ScanContext;
import dev.jbang.pypimirror.scraper.SnapshotConfig;
import dev.jbang.pypimirror.util.HttpUtils;
import dev.jbang.pypimirror.util.InvalidProxyException;
import dev.jbang.pypimirror.util.ProxySettings;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/** Snapshot command scanning the PyPI index and printing all artifact paths */
@Command(
		name = "snapshot",
		description = "Scan a PyPI simple index and print the path of every artifact below the package base",
		mixinStandardHelpOptions = true)
public class SnapshotCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	/** Output formats for the snapshot */
	public enum Format {
		text,
		json
	}

	/** JSON document written with {@code --format json} */
	public record SnapshotDocument(String packageBase, int count, List<String> entries) {}

	@Spec
	CommandSpec spec;

	@Option(
			names = {"--simple-base"},
			description = "Base of simple index (default: ${DEFAULT-VALUE})",
			defaultValue = SnapshotConfig.DEFAULT_SIMPLE_BASE)
	private String simpleBase;

	@Option(
			names = {"--package-base"},
			description = "Base of package files (default: ${DEFAULT-VALUE})",
			defaultValue = SnapshotConfig.DEFAULT_PACKAGE_BASE)
	private String packageBase;

	@Option(
			names = {"--bq-query"},
			description = "Only scan the 1000 most downloaded packages of the last day, as reported by BigQuery."
					+ " Needs PROJECT_ID and Google application default credentials")
	private boolean bqQuery;

	@Option(
			names = {"--keep-recent"},
			description = "Only keep the N most recent versions of every package")
	private Integer keepRecent;

	@Option(
			names = {"--debug"},
			description = "Only scan the packages found in the first 1000 characters of the index")
	private boolean debug;

	@Option(
			names = {"-t", "--threads"},
			description = "Maximum number of package indexes fetched in parallel (default: ${DEFAULT-VALUE})",
			defaultValue = "" + SnapshotConfig.DEFAULT_CONCURRENCY)
	private int threads;

	@Option(
			names = {"--format"},
			description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
			defaultValue = "text")
	private Format format;

	Map<String, String> environment = System.getenv();

	@Override
	public Integer call() throws Exception {
		ProxySettings proxySettings;
		SnapshotConfig config;
		try {
			proxySettings = ProxySettings.fromEnvironment(environment);
			config = new SnapshotConfig(
					simpleBase,
					packageBase,
					bqQuery ? DiscoveryMode.POPULARITY : DiscoveryMode.FULL_INDEX,
					keepRecent != null ? new RetentionBudget(keepRecent) : null,
					debug,
					threads);
		} catch (InvalidProxyException e) {
			logger.error("Error: {}", e.getMessage());
			return 1;
		} catch (IllegalArgumentException e) {
			logger.error("Invalid configuration: {}", e.getMessage());
			return 1;
		}

		try (var reporter = new ProgressReporter()) {
			reporter.start();
			var context = new ScanContext(LoggerFactory.getLogger("pypi"), reporter, new HttpUtils(proxySettings));
			var source = new PypiSnapshot(config, context, BigQueryExecutor.fromEnvironment(environment, proxySettings));
			logger.info("Taking snapshot of {}", source.describe());

			long startTime = System.currentTimeMillis();
			List<SnapshotPath> snapshot = source.snapshot();
			write(snapshot, config);

			var duration = (System.currentTimeMillis() - startTime) / 1000.0;
			logger.info("Snapshot of {} artifacts completed in {} seconds", snapshot.size(), duration);
			return 0;
		} catch (DiscoveryException e) {
			logger.error("Failed to discover packages: {}", e.getMessage(), e);
			return 1;
		}
	}

	private void write(List<SnapshotPath> snapshot, SnapshotConfig config) throws IOException {
		PrintWriter out = spec.commandLine().getOut();
		switch (format) {
			case text -> snapshot.forEach(path -> out.println(path.path()));
			case json -> {
				ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
				var document = new SnapshotDocument(
						config.packageBase(),
						snapshot.size(),
						snapshot.stream().map(SnapshotPath::path).toList());
				out.println(mapper.writeValueAsString(document));
			}
		}
		out.flush();
	}
}
