package dev.jbang.libfetch;

import dev.jbang.libfetch.account.AccountStore;
import dev.jbang.libfetch.account.UnknownAccountException;
import dev.jbang.libfetch.engine.AuditLog;
import dev.jbang.libfetch.engine.EngineConfig;
import dev.jbang.libfetch.engine.Orchestrator;
import dev.jbang.libfetch.engine.RunResult;
import dev.jbang.libfetch.engine.Sleeper;
import dev.jbang.libfetch.engine.StopSignal;
import dev.jbang.libfetch.queue.DownloadQueue;
import dev.jbang.libfetch.queue.JsonStatusStore;
import dev.jbang.libfetch.retry.RetryPolicy;
import dev.jbang.libfetch.rotation.RotationPolicy;
import dev.jbang.libfetch.session.CookieSessionProvider;
import dev.jbang.libfetch.transfer.HttpTransfer;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

/** Shared options and wiring of the commands that drive the orchestrator */
abstract class EngineCommand implements Callable<Integer> {
	protected static final Logger logger = LoggerFactory.getLogger("command");

	static final int EXIT_CONFIG_ERROR = 2;

	@Option(
			names = {"-d", "--data-dir"},
			description = "Directory holding accounts.json, status.json, sessions/, files/ and logs/ (default: ebooks)",
			defaultValue = FetcherPaths.DEFAULT_DATA_DIR)
	protected Path dataDir;

	@Option(
			names = {"--rotation-threshold"},
			description = "Number of downloads after which to switch to the next account (default: 10)",
			defaultValue = "10")
	protected int rotationThreshold;

	@Option(
			names = {"--failure-threshold"},
			description = "Number of consecutive failures after which to switch to the next account (default: 3)",
			defaultValue = "3")
	protected int failureThreshold;

	@Option(
			names = {"--max-attempts"},
			description = "Maximum number of attempts per item and run (default: 3)",
			defaultValue = "3")
	protected int maxAttempts;

	@Option(
			names = {"--min-size"},
			description = "Minimum size in bytes of a valid download (default: 1000)",
			defaultValue = "1000")
	protected long minSize;

	@Option(
			names = {"--max-size"},
			description = "Maximum size in bytes of a valid download (default: 524288000)",
			defaultValue = "524288000")
	protected long maxSize;

	@Option(
			names = {"--delay"},
			description = "Seconds to wait between two items (default: 2)",
			defaultValue = "2")
	protected int delaySeconds;

	@Option(
			names = {"--timeout"},
			description = "Seconds after which a single download is abandoned (default: 300)",
			defaultValue = "300")
	protected int timeoutSeconds;

	/** Run the orchestrator; the stop signal is raised when the JVM is asked to shut down */
	protected abstract RunResult execute(Orchestrator orchestrator);

	protected abstract String title();

	@Override
	public Integer call() throws Exception {
		FetcherPaths paths = new FetcherPaths(dataDir);
		Clock clock = Clock.systemDefaultZone();

		logger.info("Library Fetcher - {}", title());
		logger.info("==================");
		logger.info("Data directory: {}", dataDir.toAbsolutePath());
		logger.info("");

		AccountStore accounts;
		DownloadQueue queue;
		EngineConfig config;
		RotationPolicy rotationPolicy;
		RetryPolicy retryPolicy;
		HttpTransfer transfer;
		try {
			config = new EngineConfig(paths.filesDir(), minSize, maxSize, Duration.ofSeconds(delaySeconds));
			rotationPolicy = new RotationPolicy(rotationThreshold, failureThreshold);
			retryPolicy = new RetryPolicy(maxAttempts, RetryPolicy.DEFAULT_BACKOFF_BASE, RetryPolicy.DEFAULT_BACKOFF_CAP);
			transfer = new HttpTransfer(Duration.ofSeconds(timeoutSeconds));
			accounts = AccountStore.load(paths.accountsFile(), clock);
			queue = DownloadQueue.load(new JsonStatusStore(paths.statusFile()));
		} catch (IOException | IllegalArgumentException e) {
			logger.error("Error: Failed to load configuration: {}", e.getMessage());
			return EXIT_CONFIG_ERROR;
		}
		if (accounts.size() == 0) {
			logger.error("Error: No accounts configured in {}", paths.accountsFile().toAbsolutePath());
			return EXIT_CONFIG_ERROR;
		}

		StopSignal stopSignal = new StopSignal();
		CountDownLatch finished = new CountDownLatch(1);
		Thread shutdownHook = new Thread(
				() -> {
					stopSignal.request();
					logger.info("Stopping after the current download...");
					try {
						finished.await();
					} catch (InterruptedException e) {
						Thread.currentThread().interrupt();
					}
				},
				"fetcher-shutdown");
		Runtime.getRuntime().addShutdownHook(shutdownHook);

		Path auditFile = paths.logsDir().resolve(AuditLog.FILE_DOWNLOAD_LOG);
		try (AuditLog auditLog = AuditLog.open(auditFile, "FILE DOWNLOAD", clock)) {
			Orchestrator orchestrator = new Orchestrator(
					config,
					accounts,
					queue,
					new CookieSessionProvider(paths.sessionsDir(), clock),
					transfer,
					rotationPolicy,
					retryPolicy,
					clock,
					Sleeper.SYSTEM,
					stopSignal,
					auditLog);
			RunResult result = execute(orchestrator);
			printSummary(result);
			StatsCommand.printAccounts(accounts, clock);
			logger.info("Log written to {}", auditFile.toAbsolutePath());
			return result.outcome().exitCode();
		} catch (UnknownAccountException e) {
			logger.error("Error: {} - check {}", e.getMessage(), paths.accountsFile());
			return EXIT_CONFIG_ERROR;
		} catch (Exception e) {
			logger.error("Error: {}", e.getMessage());
			logger.debug("Run failed", e);
			return 1;
		} finally {
			finished.countDown();
			removeShutdownHook(shutdownHook);
		}
	}

	static void printSummary(RunResult result) {
		logger.info("");
		logger.info("Summary");
		logger.info("=======");
		logger.info("Outcome: {}", result.outcome());
		logger.info("Done: {}", result.done());
		logger.info("Failed: {}", result.failed());
		logger.info("Skipped: {}", result.skipped());
		logger.info("Pending: {}", result.pending());
		if (!result.failures().isEmpty()) {
			logger.info("");
			logger.info("Failed items:");
			result.failures().forEach((id, kind) -> logger.info("  - {} ({})", id, kind));
		}
	}

	static void removeShutdownHook(Thread shutdownHook) {
		try {
			Runtime.getRuntime().removeShutdownHook(shutdownHook);
		} catch (IllegalStateException e) {
			// Already shutting down, the hook is running
			logger.debug("Shutdown in progress, keeping shutdown hook");
		}
	}
}
