package dev.jbang.libfetch;

import dev.jbang.libfetch.queue.DownloadQueue;
import dev.jbang.libfetch.queue.JsonStatusStore;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Requeue command to give failed items another chance */
@Command(
		name = "requeue",
		description = "Put all FAILED items back to PENDING so the next run attempts them again",
		mixinStandardHelpOptions = true)
public class RequeueCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-d", "--data-dir"},
			description = "Directory holding status.json (default: ebooks)",
			defaultValue = FetcherPaths.DEFAULT_DATA_DIR)
	private Path dataDir;

	@Option(
			names = {"--covers"},
			description = "Requeue failed covers instead of failed items")
	private boolean covers;

	@Override
	public Integer call() throws Exception {
		try {
			DownloadQueue queue = DownloadQueue.load(new JsonStatusStore(new FetcherPaths(dataDir).statusFile()));
			if (covers) {
				logger.info("Requeued {} failed covers", queue.requeueFailedCovers());
			} else {
				logger.info("Requeued {} failed items", queue.requeueFailed());
			}
			return 0;
		} catch (IOException | UncheckedIOException | IllegalArgumentException e) {
			logger.error("Error: Failed to update item status: {}", e.getMessage());
			return EngineCommand.EXIT_CONFIG_ERROR;
		}
	}
}
