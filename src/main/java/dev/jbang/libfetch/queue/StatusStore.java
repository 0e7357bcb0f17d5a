package dev.jbang.libfetch.queue;

import java.io.IOException;
import java.util.List;

/** Durable record of every work item and its status */
public interface StatusStore {
	/**
	 * Load all items in the order they were first added.
	 *
	 * @return The stored items, empty if nothing has been stored yet
	 */
	List<WorkItem> load() throws IOException;

	/**
	 * Replace the stored items with the given ones. Must leave either the old or the new content
	 * behind if interrupted.
	 */
	void save(List<WorkItem> items) throws IOException;
}
