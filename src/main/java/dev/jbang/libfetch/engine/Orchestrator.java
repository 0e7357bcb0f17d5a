package dev.jbang.libfetch.engine;

import dev.jbang.libfetch.account.Account;
import dev.jbang.libfetch.account.AccountStore;
import dev.jbang.libfetch.error.ErrorKind;
import dev.jbang.libfetch.error.FetchException;
import dev.jbang.libfetch.error.ValidationException;
import dev.jbang.libfetch.queue.DownloadQueue;
import dev.jbang.libfetch.queue.ItemStatus;
import dev.jbang.libfetch.queue.WorkItem;
import dev.jbang.libfetch.retry.ErrorClass;
import dev.jbang.libfetch.retry.RetryPolicy;
import dev.jbang.libfetch.rotation.NoAccountAvailableException;
import dev.jbang.libfetch.rotation.RotationPolicy;
import dev.jbang.libfetch.rotation.RotationState;
import dev.jbang.libfetch.session.Session;
import dev.jbang.libfetch.session.SessionProvider;
import dev.jbang.libfetch.transfer.Transfer;
import dev.jbang.libfetch.util.FileUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Works through the download queue one item at a time. For every item it asks the rotation policy
 * for an account, logs in through the session provider, runs the transfer and records the outcome.
 * Failures of a single item never end the run; only running out of accounts, a stop request or a
 * configuration defect do.
 */
public class Orchestrator {
	private static final Logger logger = LoggerFactory.getLogger(Orchestrator.class);

	private final EngineConfig config;
	private final AccountStore accounts;
	private final DownloadQueue queue;
	private final SessionProvider sessionProvider;
	private final Transfer transfer;
	private final RotationPolicy rotationPolicy;
	private final RetryPolicy retryPolicy;
	private final Clock clock;
	private final Sleeper sleeper;
	private final StopSignal stopSignal;
	private final AuditLog auditLog;

	private enum ItemOutcome {
		DONE,
		FAILED,
		SKIPPED,
		CANCELLED
	}

	public Orchestrator(
			EngineConfig config,
			AccountStore accounts,
			DownloadQueue queue,
			SessionProvider sessionProvider,
			Transfer transfer,
			RotationPolicy rotationPolicy,
			RetryPolicy retryPolicy,
			Clock clock,
			Sleeper sleeper,
			StopSignal stopSignal) {
		this(config, accounts, queue, sessionProvider, transfer, rotationPolicy, retryPolicy, clock, sleeper, stopSignal,
				AuditLog.none());
	}

	public Orchestrator(
			EngineConfig config,
			AccountStore accounts,
			DownloadQueue queue,
			SessionProvider sessionProvider,
			Transfer transfer,
			RotationPolicy rotationPolicy,
			RetryPolicy retryPolicy,
			Clock clock,
			Sleeper sleeper,
			StopSignal stopSignal,
			AuditLog auditLog) {
		this.config = config;
		this.accounts = accounts;
		this.queue = queue;
		this.sessionProvider = sessionProvider;
		this.transfer = transfer;
		this.rotationPolicy = rotationPolicy;
		this.retryPolicy = retryPolicy;
		this.clock = clock;
		this.sleeper = sleeper;
		this.stopSignal = stopSignal;
		this.auditLog = auditLog;
	}

	/**
	 * Process every PENDING item until the queue is drained, no account is left or a stop is
	 * requested.
	 *
	 * @throws dev.jbang.libfetch.account.UnknownAccountException if the account configuration is
	 *     inconsistent
	 */
	public RunResult runAll() {
		logger.info("Starting run: {} items pending, {} accounts", queue.count(ItemStatus.PENDING), accounts.size());
		RotationState state = new RotationState();
		SessionSlot slot = new SessionSlot();
		int attempted = 0;

		try {
			while (true) {
				if (stopSignal.isRequested()) {
					logger.info("Stop requested, ending run");
					return finish(RunOutcome.CANCELLED, attempted);
				}
				Optional<WorkItem> next = queue.nextPending();
				if (next.isEmpty()) {
					break;
				}
				if (attempted > 0 && !pause(config.delayBetweenItems())) {
					continue;
				}

				attempted++;
				ItemOutcome outcome = process(next.get(), state, slot);
				if (outcome == ItemOutcome.CANCELLED) {
					logger.info("Stop requested, ending run");
					return finish(RunOutcome.CANCELLED, attempted);
				}
			}
		} catch (NoAccountAvailableException e) {
			logger.warn("{}; stopping with {} items still pending", e.getMessage(), queue.count(ItemStatus.PENDING));
			return finish(RunOutcome.QUOTA_EXHAUSTED, attempted);
		}

		RunOutcome outcome =
				queue.count(ItemStatus.FAILED) > 0 ? RunOutcome.COMPLETED_WITH_FAILURES : RunOutcome.COMPLETED;
		return finish(outcome, attempted);
	}

	/**
	 * Process a single item, whatever its position in the queue. Items that are already DONE or
	 * SKIPPED are left alone; FAILED items are attempted again.
	 *
	 * @throws IllegalArgumentException if there is no item with the given id
	 */
	public RunResult runOne(String itemId) {
		WorkItem item = queue.get(itemId).orElseThrow(() -> new IllegalArgumentException("Unknown item ID: " + itemId));
		if (item.status().isComplete()) {
			logger.info("Item {} is already {}, nothing to do", itemId, item.status());
			return finish(RunOutcome.COMPLETED, 0);
		}
		if (stopSignal.isRequested()) {
			return finish(RunOutcome.CANCELLED, 0);
		}

		try {
			ItemOutcome outcome = process(item, new RotationState(), new SessionSlot());
			return switch (outcome) {
				case DONE, SKIPPED -> finish(RunOutcome.COMPLETED, 1);
				case FAILED -> finish(RunOutcome.COMPLETED_WITH_FAILURES, 1);
				case CANCELLED -> finish(RunOutcome.CANCELLED, 1);
			};
		} catch (NoAccountAvailableException e) {
			logger.warn("{}; item {} keeps status {}", e.getMessage(), itemId, item.status());
			return finish(RunOutcome.QUOTA_EXHAUSTED, 1);
		}
	}

	private ItemOutcome process(WorkItem item, RotationState state, SessionSlot slot) {
		String id = item.id();
		Path destination = destinationFor(item);
		String fileName = destination.getFileName().toString();
		if (Files.exists(destination)) {
			logger.info("Skipping {}: {} already exists", id, fileName);
			queue.markSkipped(id, fileName);
			auditLog.record("{}: ALREADY EXISTS", fileName);
			return ItemOutcome.SKIPPED;
		}

		ItemStatus before = item.status();
		queue.markInProgress(id);
		while (true) {
			if (stopSignal.isRequested()) {
				queue.restore(id, before);
				return ItemOutcome.CANCELLED;
			}

			Account account;
			try {
				account = rotationPolicy.select(accounts, state, today());
			} catch (NoAccountAvailableException e) {
				queue.restore(id, before);
				throw e;
			}

			long size;
			try {
				Session session = slot.sessionFor(account);
				logger.info("Downloading {} ({}) with account {}", id, fileName, account.id());
				size = transfer.transfer(session, item.locator(), destination);
				validateSize(config, size, destination);
			} catch (RuntimeException e) {
				Optional<ItemOutcome> outcome = handleFailure(item, account, state, slot, e);
				if (outcome.isPresent()) {
					return outcome.get();
				}
				continue;
			}

			accounts.recordSuccess(account.id());
			rotationPolicy.onSuccess(state);
			queue.markDone(id, account.id(), size, fileName);
			logger.info("Downloaded {} ({} bytes) with account {}", fileName, size, account.id());
			auditLog.record("{}: SUCCESS - {} - {} ({})", id, item.title(), item.author(), account.id());
			return ItemOutcome.DONE;
		}
	}

	/** Returns the final outcome of the item, or empty if it should be attempted again */
	private Optional<ItemOutcome> handleFailure(
			WorkItem item, Account account, RotationState state, SessionSlot slot, RuntimeException error) {
		ErrorClass errorClass = retryPolicy.classify(error);
		ErrorKind kind = error instanceof FetchException fetchError ? fetchError.kind() : ErrorKind.UNEXPECTED;
		String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
		if (kind == ErrorKind.UNEXPECTED) {
			logger.error("Unexpected error while downloading {}", item.id(), error);
		}

		accounts.recordFailure(account.id());
		rotationPolicy.onFailure(state, kind);
		if (errorClass == ErrorClass.AUTH_FAILURE || errorClass == ErrorClass.QUOTA_EXHAUSTED) {
			slot.invalidate();
		}
		queue.recordAttempt(item.id(), kind, message);

		if (!retryPolicy.shouldRetry(item, errorClass)) {
			queue.markFailed(item.id(), kind, message);
			logger.error("Failed to download {} after {} attempts: {} - {}", item.id(), item.runAttempts(), kind, message);
			auditLog.record("{}: FAILED ({}) - {} - {}", item.id(), kind, item.title(), item.author());
			return Optional.of(ItemOutcome.FAILED);
		}

		if (errorClass == ErrorClass.TRANSIENT) {
			Duration delay = retryPolicy.backoff(item.runAttempts());
			logger.warn(
					"Attempt {}/{} for {} failed ({}: {}), retrying in {}s",
					item.runAttempts(),
					retryPolicy.maxAttempts(),
					item.id(),
					kind,
					message,
					delay.toSeconds());
			pause(delay);
		} else {
			logger.warn(
					"Attempt {}/{} for {} failed ({}: {}), retrying with another account",
					item.runAttempts(),
					retryPolicy.maxAttempts(),
					item.id(),
					kind,
					message);
		}
		return Optional.empty();
	}

	/** Reject a download outside the configured size bounds, removing the file it left behind */
	static void validateSize(EngineConfig config, long size, Path destination) {
		if (size >= config.minFileSize() && size <= config.maxFileSize()) {
			return;
		}
		try {
			Files.deleteIfExists(destination);
		} catch (IOException e) {
			logger.warn("Failed to remove rejected file {}: {}", destination, e.getMessage());
		}
		String reason = size < config.minFileSize() ? "too small" : "too large";
		throw new ValidationException("File " + destination.getFileName() + " is " + reason + " (" + size
				+ " bytes, allowed " + config.minFileSize() + "-" + config.maxFileSize() + ")");
	}

	/**
	 * The file the item is stored in. When the "title - author" name is already taken by another
	 * item the item's id is appended, so items sharing a title never shadow each other.
	 */
	Path destinationFor(WorkItem item) {
		String extension = item.extension() == null || item.extension().isBlank()
				? WorkItem.DEFAULT_EXTENSION
				: item.extension();
		String baseName = FileUtils.sanitizeFilename(item.title(), item.author());
		String fileName = baseName + "." + extension;
		if (ownedByOther(fileName, item)) {
			fileName = FileUtils.withIdSuffix(baseName, item.id()) + "." + extension;
		}
		return config.filesDir().resolve(fileName);
	}

	private boolean ownedByOther(String fileName, WorkItem item) {
		return queue.fileOwner(fileName).filter(owner -> !owner.equals(item.id())).isPresent();
	}

	/** Waits for the given time; an interrupt is turned into a stop request */
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

	private LocalDate today() {
		return LocalDate.now(clock);
	}

	private RunResult finish(RunOutcome outcome, int attempted) {
		Map<String, ErrorKind> failures = new LinkedHashMap<>();
		for (WorkItem item : queue.items()) {
			if (item.status() == ItemStatus.FAILED) {
				failures.put(item.id(), item.lastError() != null ? item.lastError() : ErrorKind.UNEXPECTED);
			}
		}
		Map<ItemStatus, Integer> counts = queue.countsByStatus();
		RunResult result = new RunResult(
				outcome,
				counts.get(ItemStatus.DONE),
				counts.get(ItemStatus.FAILED),
				counts.get(ItemStatus.SKIPPED),
				counts.get(ItemStatus.PENDING) + counts.get(ItemStatus.IN_PROGRESS),
				attempted,
				failures);
		logger.info("Run finished: {}", result);
		return result;
	}

	/** The one session of a run, bound to the account that is currently active */
	private class SessionSlot {
		private Session current;

		Session sessionFor(Account account) {
			if (current != null && current.accountId().equals(account.id())) {
				return current;
			}
			current = null;
			logger.debug("Acquiring session for account {}", account.id());
			current = sessionProvider.acquire(account);
			return current;
		}

		void invalidate() {
			current = null;
		}
	}
}
