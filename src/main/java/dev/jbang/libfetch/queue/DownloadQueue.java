package dev.jbang.libfetch.queue;

import dev.jbang.libfetch.error.ErrorKind;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * All work items keyed by id, in the order they were added. Every status change is written to the
 * {@link StatusStore} before the method returns, so a crash loses at most the status of the item
 * being transferred at that moment. All operations are mutually exclusive.
 */
public class DownloadQueue {
	private static final Logger logger = LoggerFactory.getLogger(DownloadQueue.class);

	private final StatusStore store;
	private final Map<String, WorkItem> items;

	private DownloadQueue(StatusStore store, List<WorkItem> loaded) {
		this.store = store;
		this.items = new LinkedHashMap<>();
		int interrupted = 0;
		for (WorkItem item : loaded) {
			if (item.id() == null || item.id().isBlank()) {
				throw new IllegalArgumentException("Work item without an ID");
			}
			if (items.putIfAbsent(item.id(), item) != null) {
				throw new IllegalArgumentException("Duplicate work item ID: " + item.id());
			}
			if (item.status() == null || item.status() == ItemStatus.IN_PROGRESS) {
				// A transfer that was cut short leaves no guarantee of a complete file
				item.pending();
				interrupted++;
			}
			if (item.coverStatus() == null || item.coverStatus() == ItemStatus.IN_PROGRESS) {
				item.restoreCover(ItemStatus.PENDING);
			}
		}
		if (interrupted > 0) {
			logger.info("Restored {} interrupted items to PENDING", interrupted);
		}
	}

	/** Load the queue from its status store */
	public static DownloadQueue load(StatusStore store) throws IOException {
		return new DownloadQueue(store, store.load());
	}

	/** The earliest added PENDING item, if any */
	public synchronized Optional<WorkItem> nextPending() {
		return items.values().stream()
				.filter(item -> item.status() == ItemStatus.PENDING)
				.findFirst();
	}

	public synchronized Optional<WorkItem> get(String id) {
		return Optional.ofNullable(items.get(id));
	}

	public synchronized void markInProgress(String id) {
		require(id).startRun();
		persist();
	}

	/** Count a failed attempt without changing the item's status */
	public synchronized void recordAttempt(String id, ErrorKind kind, String message) {
		require(id).attempted(kind, message);
		persist();
	}

	/** Record a completed download, stored in {@code file} inside the files directory */
	public synchronized void markDone(String id, String accountId, long size, String file) {
		require(id).done(accountId, size, file);
		persist();
	}

	public synchronized void markFailed(String id, ErrorKind kind, String message) {
		require(id).failed(kind, message);
		persist();
	}

	/** Mark an item whose file already exists in the files directory */
	public synchronized void markSkipped(String id, String file) {
		require(id).skipped(file);
		persist();
	}

	/**
	 * Put an item back to the status it had before {@link #markInProgress(String)}, used when a run
	 * stops before the item's attempt finished. Attempts recorded meanwhile are kept.
	 */
	public synchronized void restore(String id, ItemStatus previous) {
		if (previous == null || previous == ItemStatus.IN_PROGRESS) {
			throw new IllegalArgumentException("Cannot restore item " + id + " to " + previous);
		}
		require(id).restore(previous);
		persist();
	}

	/** The id of the item that owns the given file in the files directory, if any */
	public synchronized Optional<String> fileOwner(String file) {
		return items.values().stream()
				.filter(item -> file.equals(item.file()))
				.map(WorkItem::id)
				.findFirst();
	}

	/** The earliest added item whose cover has not been handled yet */
	public synchronized Optional<WorkItem> nextPendingCover() {
		return items.values().stream()
				.filter(item -> item.coverStatus() == ItemStatus.PENDING)
				.findFirst();
	}

	public synchronized void markCoverDone(String id, String coverFile) {
		require(id).coverDone(coverFile);
		persist();
	}

	/** Mark a cover whose file already exists in the covers directory */
	public synchronized void markCoverSkipped(String id, String coverFile) {
		require(id).coverSkipped(coverFile);
		persist();
	}

	public synchronized void markCoverFailed(String id, ErrorKind kind, String message) {
		require(id).coverFailed(kind, message);
		persist();
	}

	/** The id of the item that owns the given file in the covers directory, if any */
	public synchronized Optional<String> coverFileOwner(String coverFile) {
		return items.values().stream()
				.filter(item -> coverFile.equals(item.coverFile()))
				.map(WorkItem::id)
				.findFirst();
	}

	/**
	 * Add new items; items whose id is already known are left alone.
	 *
	 * @return The number of items actually added
	 */
	public synchronized int addAll(List<WorkItem> newItems) {
		int added = 0;
		for (WorkItem item : newItems) {
			if (item.id() == null || item.id().isBlank()) {
				throw new IllegalArgumentException("Work item without an ID");
			}
			if (items.putIfAbsent(item.id(), item) == null) {
				item.pending();
				added++;
			}
		}
		if (added > 0) {
			persist();
		}
		return added;
	}

	/**
	 * Put all FAILED items back to PENDING so a later run attempts them again.
	 *
	 * @return The number of requeued items
	 */
	public synchronized int requeueFailed() {
		int requeued = 0;
		for (WorkItem item : items.values()) {
			if (item.status() == ItemStatus.FAILED) {
				item.pending();
				requeued++;
			}
		}
		if (requeued > 0) {
			persist();
		}
		return requeued;
	}

	/**
	 * Put all FAILED covers back to PENDING.
	 *
	 * @return The number of requeued covers
	 */
	public synchronized int requeueFailedCovers() {
		int requeued = 0;
		for (WorkItem item : items.values()) {
			if (item.coverStatus() == ItemStatus.FAILED) {
				item.restoreCover(ItemStatus.PENDING);
				requeued++;
			}
		}
		if (requeued > 0) {
			persist();
		}
		return requeued;
	}

	public synchronized Map<ItemStatus, Integer> countsByStatus() {
		Map<ItemStatus, Integer> counts = emptyCounts();
		for (WorkItem item : items.values()) {
			counts.merge(item.status(), 1, Integer::sum);
		}
		return counts;
	}

	public synchronized Map<ItemStatus, Integer> coverCountsByStatus() {
		Map<ItemStatus, Integer> counts = emptyCounts();
		for (WorkItem item : items.values()) {
			counts.merge(item.coverStatus(), 1, Integer::sum);
		}
		return counts;
	}

	public synchronized int count(ItemStatus status) {
		return countsByStatus().get(status);
	}

	public synchronized List<WorkItem> items() {
		return List.copyOf(items.values());
	}

	public synchronized int size() {
		return items.size();
	}

	private static Map<ItemStatus, Integer> emptyCounts() {
		Map<ItemStatus, Integer> counts = new EnumMap<>(ItemStatus.class);
		for (ItemStatus status : ItemStatus.values()) {
			counts.put(status, 0);
		}
		return counts;
	}

	private WorkItem require(String id) {
		WorkItem item = items.get(id);
		if (item == null) {
			throw new IllegalArgumentException("Unknown item ID: " + id);
		}
		return item;
	}

	private void persist() {
		try {
			store.save(new ArrayList<>(items.values()));
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to save item status", e);
		}
	}
}
