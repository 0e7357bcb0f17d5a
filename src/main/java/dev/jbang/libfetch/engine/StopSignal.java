package dev.jbang.libfetch.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * External request to end a run. The orchestrator only looks at it between attempts, never in the
 * middle of a transfer.
 */
public class StopSignal {
	private final AtomicBoolean requested = new AtomicBoolean(false);

	public void request() {
		requested.set(true);
	}

	public boolean isRequested() {
		return requested.get();
	}
}
