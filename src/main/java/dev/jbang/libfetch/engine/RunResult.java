package dev.jbang.libfetch.engine;

import dev.jbang.libfetch.error.ErrorKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of an orchestrator run. The counts describe the whole queue after the run; {@code
 * attempted} is the number of items this run worked on.
 */
public record RunResult(
		RunOutcome outcome,
		int done,
		int failed,
		int skipped,
		int pending,
		int attempted,
		Map<String, ErrorKind> failures) {

	public RunResult {
		failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
	}

	public boolean success() {
		return outcome == RunOutcome.COMPLETED;
	}

	@Override
	public String toString() {
		String summary = "%d done, %d failed, %d skipped, %d pending (%d items attempted in this run)"
				.formatted(done, failed, skipped, pending, attempted);
		return switch (outcome) {
			case COMPLETED -> "COMPLETED - " + summary;
			case COMPLETED_WITH_FAILURES -> "COMPLETED WITH FAILURES - " + summary;
			case QUOTA_EXHAUSTED -> "INCOMPLETE - quota exhausted - " + summary;
			case CANCELLED -> "CANCELLED - " + summary;
		};
	}
}
