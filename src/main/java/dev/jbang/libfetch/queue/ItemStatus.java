package dev.jbang.libfetch.queue;

public enum ItemStatus {
	PENDING,
	IN_PROGRESS,
	DONE,
	FAILED,
	SKIPPED;

	/** Terminal items are never attempted again by a run */
	public boolean isComplete() {
		return this == DONE || this == SKIPPED;
	}
}
