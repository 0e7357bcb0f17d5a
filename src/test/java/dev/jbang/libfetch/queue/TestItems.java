package dev.jbang.libfetch.queue;

/** Builds work items in a given state, as they would be read from status.json */
public final class TestItems {

	private TestItems() {}

	public static WorkItem withAttempts(WorkItem item, int attempts) {
		return item.attempts(attempts);
	}
}
