package dev.jbang.libfetch;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/** Main application class with CLI support */
@Command(
		name = "library-fetcher",
		version = "1.0.0",
		description = "Downloads queued items from a rate-limited source, rotating across a pool of accounts",
		mixinStandardHelpOptions = true,
		subcommands = {
			RunCommand.class,
			FetchCommand.class,
			CoversCommand.class,
			StatsCommand.class,
			ImportCommand.class,
			RequeueCommand.class
		})
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
