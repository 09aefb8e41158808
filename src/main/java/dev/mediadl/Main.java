package dev.mediadl;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/** Main application class with CLI support */
@Command(
		name = "mediadl",
		version = "1.0.0",
		description = "Downloads media files in bulk with a strict concurrency ceiling",
		mixinStandardHelpOptions = true,
		subcommands = {FetchCommand.class, PlanCommand.class})
public class Main implements Callable<Integer> {

	@Spec
	CommandSpec spec;

	@Override
	public Integer call() {
		spec.commandLine().usage(System.out);
		return 0;
	}

	static CommandLine commandLine() {
		return new CommandLine(new Main()).setCaseInsensitiveEnumValuesAllowed(true);
	}

	public static void main(String[] args) {
		int exitCode = commandLine().execute(args);
		System.exit(exitCode);
	}
}
