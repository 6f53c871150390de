package dev.jbang.pypimirror;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/** Main application class with CLI support */
@Command(
		name = "pypi-mirror-snapshot",
		version = "1.0.0",
		description = "Takes snapshots of a PyPI simple index for mirror synchronization",
		mixinStandardHelpOptions = true,
		subcommands = {SnapshotCommand.class, ResolveCommand.class})
public class Main implements Runnable {

	@Spec
	CommandSpec spec;

	@Override
	public void run() {
		spec.commandLine().usage(spec.commandLine().getOut());
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
