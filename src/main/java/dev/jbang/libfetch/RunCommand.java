package dev.jbang.libfetch;

import dev.jbang.libfetch.engine.Orchestrator;
import dev.jbang.libfetch.engine.RunResult;
import picocli.CommandLine.Command;

/** Run command to download all pending items */
@Command(
		name = "run",
		description = "Download all pending items, rotating accounts as needed. Exit code 3 means the run "
				+ "stopped because every account used up its daily quota.",
		mixinStandardHelpOptions = true)
public class RunCommand extends EngineCommand {

	@Override
	protected String title() {
		return "Run";
	}

	@Override
	protected RunResult execute(Orchestrator orchestrator) {
		return orchestrator.runAll();
	}
}
