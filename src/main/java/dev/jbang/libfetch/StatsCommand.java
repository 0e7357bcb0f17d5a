package dev.jbang.libfetch;

import dev.jbang.libfetch.account.Account;
import dev.jbang.libfetch.account.AccountStore;
import dev.jbang.libfetch.queue.DownloadQueue;
import dev.jbang.libfetch.queue.ItemStatus;
import dev.jbang.libfetch.queue.JsonStatusStore;
import dev.jbang.libfetch.queue.WorkItem;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Stats command to show item counts and remaining account quota */
@Command(
		name = "stats",
		description = "Show item counts by status and the remaining daily quota of every account",
		mixinStandardHelpOptions = true)
public class StatsCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-d", "--data-dir"},
			description = "Directory holding accounts.json and status.json (default: ebooks)",
			defaultValue = FetcherPaths.DEFAULT_DATA_DIR)
	private Path dataDir;

	@Override
	public Integer call() throws Exception {
		FetcherPaths paths = new FetcherPaths(dataDir);
		Clock clock = Clock.systemDefaultZone();

		logger.info("Library Fetcher - Stats");
		logger.info("=======================");
		logger.info("Data directory: {}", dataDir.toAbsolutePath());

		DownloadQueue queue;
		AccountStore accounts;
		try {
			queue = DownloadQueue.load(new JsonStatusStore(paths.statusFile()));
			accounts = AccountStore.load(paths.accountsFile(), clock);
		} catch (IOException | IllegalArgumentException e) {
			logger.error("Error: Failed to load configuration: {}", e.getMessage());
			return EngineCommand.EXIT_CONFIG_ERROR;
		}

		logger.info("");
		logger.info("Items: {}", queue.size());
		Map<ItemStatus, Integer> counts = queue.countsByStatus();
		for (ItemStatus status : ItemStatus.values()) {
			if (status != ItemStatus.IN_PROGRESS) {
				logger.info("  {}: {}", status, counts.get(status));
			}
		}

		if (counts.get(ItemStatus.FAILED) > 0) {
			logger.info("");
			logger.info("Failed items:");
			for (WorkItem item : queue.items()) {
				if (item.status() == ItemStatus.FAILED) {
					logger.info(
							"  - {} \"{}\" after {} attempts: {} ({})",
							item.id(),
							item.title(),
							item.attempts(),
							item.lastError(),
							item.lastErrorMessage());
				}
			}
		}

		logger.info("");
		logger.info("Covers:");
		Map<ItemStatus, Integer> coverCounts = queue.coverCountsByStatus();
		for (ItemStatus status : ItemStatus.values()) {
			if (status != ItemStatus.IN_PROGRESS) {
				logger.info("  {}: {}", status, coverCounts.get(status));
			}
		}

		printAccounts(accounts, clock);
		return 0;
	}

	static void printAccounts(AccountStore accounts, Clock clock) {
		LocalDate today = LocalDate.now(clock);
		logger.info("");
		logger.info("Accounts:");
		int remaining = 0;
		for (Account account : accounts.all(today)) {
			logger.info(
					"  {} {} - {}/{} downloads, {} remaining",
					account.isUsable() ? "+" : "-",
					account.id(),
					account.dailyDownloads(),
					account.maxDailyDownloads(),
					account.remaining());
			remaining += account.remaining();
		}
		logger.info("Total remaining today: {}", remaining);
	}
}
