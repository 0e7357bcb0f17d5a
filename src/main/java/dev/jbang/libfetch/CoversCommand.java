package dev.jbang.libfetch;

import dev.jbang.libfetch.engine.AuditLog;
import dev.jbang.libfetch.engine.CoverFetcher;
import dev.jbang.libfetch.engine.EngineConfig;
import dev.jbang.libfetch.engine.RunResult;
import dev.jbang.libfetch.engine.Sleeper;
import dev.jbang.libfetch.engine.StopSignal;
import dev.jbang.libfetch.queue.DownloadQueue;
import dev.jbang.libfetch.queue.JsonStatusStore;
import dev.jbang.libfetch.retry.RetryPolicy;
import dev.jbang.libfetch.transfer.HttpTransfer;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/** Covers command to download the cover images of the queued items */
@Command(
		name = "covers",
		description = "Download the cover image of every queued item, or of a single item. Covers are public, "
				+ "no account is used.",
		mixinStandardHelpOptions = true)
public class CoversCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-d", "--data-dir"},
			description = "Directory holding status.json, covers/ and logs/ (default: ebooks)",
			defaultValue = FetcherPaths.DEFAULT_DATA_DIR)
	private Path dataDir;

	@Option(
			names = {"--max-attempts"},
			description = "Maximum number of attempts per cover (default: 3)",
			defaultValue = "3")
	private int maxAttempts;

	@Option(
			names = {"--min-size"},
			description = "Minimum size in bytes of a valid cover (default: 1000)",
			defaultValue = "1000")
	private long minSize;

	@Option(
			names = {"--delay"},
			description = "Seconds to wait between two covers (default: 1)",
			defaultValue = "1")
	private int delaySeconds;

	@Option(
			names = {"--timeout"},
			description = "Seconds after which a single cover download is abandoned (default: 60)",
			defaultValue = "60")
	private int timeoutSeconds;

	@Parameters(index = "0", arity = "0..1", description = "ID of a single item whose cover to download")
	private String itemId;

	@Override
	public Integer call() throws Exception {
		FetcherPaths paths = new FetcherPaths(dataDir);
		Clock clock = Clock.systemDefaultZone();

		logger.info("Library Fetcher - Covers");
		logger.info("========================");
		logger.info("Data directory: {}", dataDir.toAbsolutePath());
		logger.info("");

		EngineConfig config;
		RetryPolicy retryPolicy;
		HttpTransfer transfer;
		DownloadQueue queue;
		try {
			config = new EngineConfig(
					paths.coversDir(), minSize, CoverFetcher.DEFAULT_MAX_COVER_SIZE, Duration.ofSeconds(delaySeconds));
			retryPolicy = new RetryPolicy(maxAttempts, RetryPolicy.DEFAULT_BACKOFF_BASE, RetryPolicy.DEFAULT_BACKOFF_CAP);
			transfer = new HttpTransfer(Duration.ofSeconds(timeoutSeconds));
			queue = DownloadQueue.load(new JsonStatusStore(paths.statusFile()));
		} catch (IOException | IllegalArgumentException e) {
			logger.error("Error: Failed to load configuration: {}", e.getMessage());
			return EngineCommand.EXIT_CONFIG_ERROR;
		}
		if (itemId != null && queue.get(itemId).isEmpty()) {
			logger.error("Error: Unknown item ID: {}", itemId);
			return 1;
		}

		StopSignal stopSignal = new StopSignal();
		CountDownLatch finished = new CountDownLatch(1);
		Thread shutdownHook = new Thread(
				() -> {
					stopSignal.request();
					logger.info("Stopping after the current cover...");
					try {
						finished.await();
					} catch (InterruptedException e) {
						Thread.currentThread().interrupt();
					}
				},
				"covers-shutdown");
		Runtime.getRuntime().addShutdownHook(shutdownHook);

		Path auditFile = paths.logsDir().resolve(AuditLog.COVER_DOWNLOAD_LOG);
		try (AuditLog auditLog = AuditLog.open(auditFile, "COVER DOWNLOAD", clock)) {
			CoverFetcher fetcher =
					new CoverFetcher(config, queue, transfer, retryPolicy, clock, Sleeper.SYSTEM, stopSignal, auditLog);
			RunResult result = itemId != null ? fetcher.runOne(itemId) : fetcher.runAll();
			EngineCommand.printSummary(result);
			logger.info("Covers saved in {}", paths.coversDir().toAbsolutePath());
			logger.info("Log written to {}", auditFile.toAbsolutePath());
			return result.outcome().exitCode();
		} catch (Exception e) {
			logger.error("Error: {}", e.getMessage());
			logger.debug("Cover run failed", e);
			return 1;
		} finally {
			finished.countDown();
			EngineCommand.removeShutdownHook(shutdownHook);
		}
	}
}
