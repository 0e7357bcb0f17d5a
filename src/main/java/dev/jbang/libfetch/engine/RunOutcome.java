package dev.jbang.libfetch.engine;

/** How a run ended, with the process exit code a front end reports for it */
public enum RunOutcome {
	/** Nothing left to do and nothing failed */
	COMPLETED(0),
	/** Nothing left to do, but some items are FAILED */
	COMPLETED_WITH_FAILURES(1),
	/** Stopped because no account had quota left; not a failure */
	QUOTA_EXHAUSTED(3),
	/** Stopped on request */
	CANCELLED(4);

	private final int exitCode;

	RunOutcome(int exitCode) {
		this.exitCode = exitCode;
	}

	public int exitCode() {
		return exitCode;
	}
}
