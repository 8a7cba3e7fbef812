package dev.foodmole.corpus;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/** Main application class with CLI support */
@Command(
		name = "pmc-corpus",
		version = "1.0.0",
		description = "Builds a text corpus from PubMed Central open-access articles",
		mixinStandardHelpOptions = true,
		subcommands = {FilterCommand.class, DownloadCommand.class, ExtractCommand.class, CleanCommand.class})
public class Main implements Callable<Integer> {

	@Spec
	private CommandSpec spec;

	@Override
	public Integer call() {
		spec.commandLine().usage(System.out);
		return 0;
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
