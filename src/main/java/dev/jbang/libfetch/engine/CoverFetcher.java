package dev.jbang.libfetch.engine;

import dev.jbang.libfetch.error.ErrorKind;
import dev.jbang.libfetch.error.FetchException;
import dev.jbang.libfetch.queue.DownloadQueue;
import dev.jbang.libfetch.queue.ItemStatus;
import dev.jbang.libfetch.queue.WorkItem;
import dev.jbang.libfetch.retry.ErrorClass;
import dev.jbang.libfetch.retry.RetryPolicy;
import dev.jbang.libfetch.session.Session;
import dev.jbang.libfetch.transfer.Transfer;
import dev.jbang.libfetch.util.FileUtils;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads the cover image of every queued item. Covers are public, so no account or rotation is
 * involved; the queue, the skip of existing files and the size validation work as for the items
 * themselves. A cover's status is tracked next to the item's own status.
 */
public class CoverFetcher {
	private static final Logger logger = LoggerFactory.getLogger(CoverFetcher.class);

	public static final long DEFAULT_MIN_COVER_SIZE = 1000;
	public static final long DEFAULT_MAX_COVER_SIZE = 20L * 1024 * 1024;

	private final EngineConfig config;
	private final DownloadQueue queue;
	private final Transfer transfer;
	private final RetryPolicy retryPolicy;
	private final Clock clock;
	private final Sleeper sleeper;
	private final StopSignal stopSignal;
	private final AuditLog auditLog;

	private enum CoverOutcome {
		DONE,
		FAILED,
		SKIPPED,
		CANCELLED
	}

	/**
	 * @param config Where covers go ({@link EngineConfig#filesDir()}), their size bounds and the
	 *     pause between covers
	 */
	public CoverFetcher(
			EngineConfig config,
			DownloadQueue queue,
			Transfer transfer,
			RetryPolicy retryPolicy,
			Clock clock,
			Sleeper sleeper,
			StopSignal stopSignal,
			AuditLog auditLog) {
		this.config = config;
		this.queue = queue;
		this.transfer = transfer;
		this.retryPolicy = retryPolicy;
		this.clock = clock;
		this.sleeper = sleeper;
		this.stopSignal = stopSignal;
		this.auditLog = auditLog;
	}

	/** Download every cover that is still PENDING, until done or a stop is requested */
	public RunResult runAll() {
		logger.info("Starting cover run: {} covers pending", queue.coverCountsByStatus().get(ItemStatus.PENDING));
		int attempted = 0;
		while (true) {
			if (stopSignal.isRequested()) {
				logger.info("Stop requested, ending cover run");
				return finish(RunOutcome.CANCELLED, attempted);
			}
			Optional<WorkItem> next = queue.nextPendingCover();
			if (next.isEmpty()) {
				break;
			}
			if (attempted > 0 && !pause(config.delayBetweenItems())) {
				continue;
			}

			attempted++;
			if (process(next.get()) == CoverOutcome.CANCELLED) {
				logger.info("Stop requested, ending cover run");
				return finish(RunOutcome.CANCELLED, attempted);
			}
		}

		boolean failures = queue.coverCountsByStatus().get(ItemStatus.FAILED) > 0;
		return finish(failures ? RunOutcome.COMPLETED_WITH_FAILURES : RunOutcome.COMPLETED, attempted);
	}

	/**
	 * Download the cover of a single item. Covers already DONE or SKIPPED are left alone.
	 *
	 * @throws IllegalArgumentException if there is no item with the given id
	 */
	public RunResult runOne(String itemId) {
		WorkItem item = queue.get(itemId).orElseThrow(() -> new IllegalArgumentException("Unknown item ID: " + itemId));
		if (item.coverStatus().isComplete()) {
			logger.info("Cover of {} is already {}, nothing to do", itemId, item.coverStatus());
			return finish(RunOutcome.COMPLETED, 0);
		}
		if (stopSignal.isRequested()) {
			return finish(RunOutcome.CANCELLED, 0);
		}
		return switch (process(item)) {
			case DONE, SKIPPED -> finish(RunOutcome.COMPLETED, 1);
			case FAILED -> finish(RunOutcome.COMPLETED_WITH_FAILURES, 1);
			case CANCELLED -> finish(RunOutcome.CANCELLED, 1);
		};
	}

	private CoverOutcome process(WorkItem item) {
		String id = item.id();
		if (item.coverUrl() == null || item.coverUrl().isBlank()) {
			logger.warn("No cover URL for {}", id);
			queue.markCoverFailed(id, ErrorKind.PERMANENT, "No cover URL");
			auditLog.record("{}: NO COVER URL - {} - {}", id, item.title(), item.author());
			return CoverOutcome.FAILED;
		}

		Path destination = destinationFor(item);
		String fileName = destination.getFileName().toString();
		if (Files.exists(destination)) {
			logger.info("Skipping cover of {}: {} already exists", id, fileName);
			queue.markCoverSkipped(id, fileName);
			auditLog.record("{}: ALREADY EXISTS", fileName);
			return CoverOutcome.SKIPPED;
		}

		Session session = Session.anonymous(clock.instant());
		int attempts = 0;
		while (true) {
			// The cover keeps its status, nothing was recorded yet
			if (stopSignal.isRequested()) {
				return CoverOutcome.CANCELLED;
			}

			attempts++;
			long size;
			try {
				logger.info("Downloading cover {} ({}/{})", fileName, attempts, retryPolicy.maxAttempts());
				size = transfer.transfer(session, item.coverUrl(), destination);
				Orchestrator.validateSize(config, size, destination);
			} catch (RuntimeException e) {
				ErrorClass errorClass = retryPolicy.classify(e);
				ErrorKind kind = e instanceof FetchException fetchError ? fetchError.kind() : ErrorKind.UNEXPECTED;
				String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
				if (kind == ErrorKind.UNEXPECTED) {
					logger.error("Unexpected error while downloading cover of {}", id, e);
				}

				// Without an account there is nothing to rotate, only transient failures are retried
				if (errorClass != ErrorClass.TRANSIENT || !retryPolicy.shouldRetry(attempts, errorClass)) {
					queue.markCoverFailed(id, kind, message);
					logger.error("Failed to download cover of {} after {} attempts: {} - {}", id, attempts, kind, message);
					auditLog.record("{}: FAILED ({}) - {} - {}", fileName, kind, item.title(), item.author());
					return CoverOutcome.FAILED;
				}
				Duration delay = retryPolicy.backoff(attempts);
				logger.warn("Cover of {} failed ({}: {}), retrying in {}s", id, kind, message, delay.toSeconds());
				pause(delay);
				continue;
			}

			queue.markCoverDone(id, fileName);
			logger.info("Downloaded cover {} ({} bytes)", fileName, size);
			auditLog.record("{}: SUCCESS - {} - {}", fileName, item.title(), item.author());
			return CoverOutcome.DONE;
		}
	}

	/** Same naming as the item files, with the image type of the cover URL as extension */
	Path destinationFor(WorkItem item) {
		String baseName = FileUtils.sanitizeFilename(item.title(), item.author());
		String extension = FileUtils.imageExtension(item.coverUrl());
		String fileName = baseName + "." + extension;
		boolean takenByOther =
				queue.coverFileOwner(fileName).filter(owner -> !owner.equals(item.id())).isPresent();
		if (takenByOther) {
			fileName = FileUtils.withIdSuffix(baseName, item.id()) + "." + extension;
		}
		return config.filesDir().resolve(fileName);
	}

	private boolean pause(Duration duration) {
		if (duration.isZero() || duration.isNegative()) {
			return true;
		}
		try {
			sleeper.sleep(duration);
			return true;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			stopSignal.request();
			return false;
		}
	}

	private RunResult finish(RunOutcome outcome, int attempted) {
		Map<String, ErrorKind> failures = new LinkedHashMap<>();
		for (WorkItem item : queue.items()) {
			if (item.coverStatus() == ItemStatus.FAILED) {
				failures.put(item.id(), item.coverError() != null ? item.coverError() : ErrorKind.UNEXPECTED);
			}
		}
		Map<ItemStatus, Integer> counts = queue.coverCountsByStatus();
		RunResult result = new RunResult(
				outcome,
				counts.get(ItemStatus.DONE),
				counts.get(ItemStatus.FAILED),
				counts.get(ItemStatus.SKIPPED),
				counts.get(ItemStatus.PENDING) + counts.get(ItemStatus.IN_PROGRESS),
				attempted,
				failures);
		logger.info("Cover run finished: {}", result);
		return result;
	}
}
