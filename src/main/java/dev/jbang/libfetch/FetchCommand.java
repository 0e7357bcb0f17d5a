package dev.jbang.libfetch;

import dev.jbang.libfetch.engine.Orchestrator;
import dev.jbang.libfetch.engine.RunResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/** Fetch command to download a single item */
@Command(
		name = "fetch",
		description = "Download a single item by its ID, also if it failed before",
		mixinStandardHelpOptions = true)
public class FetchCommand extends EngineCommand {

	@Parameters(index = "0", description = "ID of the item to download")
	private String itemId;

	@Override
	protected String title() {
		return "Fetch " + itemId;
	}

	@Override
	protected RunResult execute(Orchestrator orchestrator) {
		return orchestrator.runOne(itemId);
	}
}
