package dev.jbang.libfetch.engine;

import static org.assertj.core.api.Assertions.*;

import dev.jbang.libfetch.error.ErrorKind;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RunResultTest {

	@Test
	void testCompletedResult() {
		// When
		RunResult result = new RunResult(RunOutcome.COMPLETED, 5, 0, 1, 0, 6, Map.of());

		// Then
		assertThat(result.success()).isTrue();
		assertThat(result.outcome().exitCode()).isZero();
		assertThat(result.toString()).isEqualTo("COMPLETED - 5 done, 0 failed, 1 skipped, 0 pending (6 items attempted in this run)");
	}

	@Test
	void testQuotaExhaustedResult() {
		// When
		RunResult result = new RunResult(RunOutcome.QUOTA_EXHAUSTED, 2, 0, 0, 3, 3, Map.of());

		// Then
		assertThat(result.success()).isFalse();
		assertThat(result.outcome().exitCode()).isEqualTo(3);
		assertThat(result.toString()).startsWith("INCOMPLETE - quota exhausted");
	}

	@Test
	void testFailuresKeepOrderAndAreUnmodifiable() {
		// Given
		Map<String, ErrorKind> failures = new LinkedHashMap<>();
		failures.put("9", ErrorKind.PERMANENT);
		failures.put("1", ErrorKind.TRANSIENT);
		failures.put("5", ErrorKind.VALIDATION);

		// When
		RunResult result = new RunResult(RunOutcome.COMPLETED_WITH_FAILURES, 0, 3, 0, 0, 3, failures);
		failures.clear();

		// Then
		assertThat(result.outcome().exitCode()).isEqualTo(1);
		assertThat(result.failures().keySet()).containsExactly("9", "1", "5");
		assertThatThrownBy(() -> result.failures().put("2", ErrorKind.UNEXPECTED))
				.isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void testCancelledExitCode() {
		assertThat(RunOutcome.CANCELLED.exitCode()).isEqualTo(4);
	}
}
