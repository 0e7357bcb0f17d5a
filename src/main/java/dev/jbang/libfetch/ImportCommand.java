package dev.jbang.libfetch;

import dev.jbang.libfetch.queue.DownloadQueue;
import dev.jbang.libfetch.queue.JsonStatusStore;
import dev.jbang.libfetch.queue.WorkItem;
import dev.jbang.libfetch.util.JsonUtils;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/** Import command to add items produced by a metadata scraper to the queue */
@Command(
		name = "import",
		description = "Add the items of a JSON file (an array of objects with id, title, author, locator, "
				+ "extension and cover_url) to the queue. Items whose ID is already queued are left unchanged.",
		mixinStandardHelpOptions = true)
public class ImportCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-d", "--data-dir"},
			description = "Directory holding status.json (default: ebooks)",
			defaultValue = FetcherPaths.DEFAULT_DATA_DIR)
	private Path dataDir;

	@Parameters(index = "0", description = "JSON file with the items to add")
	private Path itemsFile;

	@Override
	public Integer call() throws Exception {
		if (!Files.isRegularFile(itemsFile)) {
			logger.error("Error: File not found: {}", itemsFile.toAbsolutePath());
			return 1;
		}

		FetcherPaths paths = new FetcherPaths(dataDir);
		try {
			DownloadQueue queue = DownloadQueue.load(new JsonStatusStore(paths.statusFile()));
			List<WorkItem> items = JsonUtils.readList(itemsFile, WorkItem.class);

			int added = queue.addAll(items);
			logger.info(
					"Imported {} new items ({} already queued), {} items in total",
					added,
					items.size() - added,
					queue.size());
			return 0;
		} catch (IOException | UncheckedIOException | IllegalArgumentException e) {
			logger.error("Error: Failed to import {}: {}", itemsFile, e.getMessage());
			return EngineCommand.EXIT_CONFIG_ERROR;
		}
	}
}
