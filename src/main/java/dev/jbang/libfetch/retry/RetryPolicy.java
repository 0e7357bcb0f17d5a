package dev.jbang.libfetch.retry;

import dev.jbang.libfetch.error.FetchException;
import dev.jbang.libfetch.queue.WorkItem;
import java.time.Duration;

/**
 * Classifies failed attempts and decides whether an item gets another one. Pure decision logic,
 * the caller does the waiting and the bookkeeping.
 *
 * <p>Backoff for transient failures is exponential: {@code base * 2^(attempt - 1)}, capped, so with
 * the defaults 2s, 4s, 8s, 16s, 30s, 30s...
 */
public class RetryPolicy {
	public static final int DEFAULT_MAX_ATTEMPTS = 3;
	public static final Duration DEFAULT_BACKOFF_BASE = Duration.ofSeconds(2);
	public static final Duration DEFAULT_BACKOFF_CAP = Duration.ofSeconds(30);

	private final int maxAttempts;
	private final Duration backoffBase;
	private final Duration backoffCap;

	public RetryPolicy() {
		this(DEFAULT_MAX_ATTEMPTS, DEFAULT_BACKOFF_BASE, DEFAULT_BACKOFF_CAP);
	}

	public RetryPolicy(int maxAttempts, Duration backoffBase, Duration backoffCap) {
		if (maxAttempts <= 0) {
			throw new IllegalArgumentException("Maximum attempts must be positive");
		}
		this.maxAttempts = maxAttempts;
		this.backoffBase = backoffBase;
		this.backoffCap = backoffCap;
	}

	public ErrorClass classify(Throwable error) {
		if (!(error instanceof FetchException fetchError)) {
			return ErrorClass.PERMANENT;
		}
		return switch (fetchError.kind()) {
			case TRANSIENT, VALIDATION -> ErrorClass.TRANSIENT;
			case AUTHENTICATION, ACCOUNT_LOCKED -> ErrorClass.AUTH_FAILURE;
			case QUOTA_EXHAUSTED -> ErrorClass.QUOTA_EXHAUSTED;
			case PERMANENT, UNEXPECTED -> ErrorClass.PERMANENT;
		};
	}

	/** Whether the item may be attempted again in this run after failing with the given class */
	public boolean shouldRetry(WorkItem item, ErrorClass errorClass) {
		return shouldRetry(item.runAttempts(), errorClass);
	}

	/** Whether another attempt is allowed after {@code attemptsMade} attempts in this run */
	public boolean shouldRetry(int attemptsMade, ErrorClass errorClass) {
		if (errorClass == ErrorClass.PERMANENT) {
			return false;
		}
		return attemptsMade < maxAttempts;
	}

	/** Delay before the next attempt, given the number of attempts made so far (1-based) */
	public Duration backoff(int attempt) {
		if (attempt <= 0 || backoffBase.isZero()) {
			return Duration.ZERO;
		}
		// Avoid overflowing the shift for large attempt counts
		int exponent = Math.min(attempt - 1, 20);
		Duration delay = backoffBase.multipliedBy(1L << exponent);
		return delay.compareTo(backoffCap) > 0 ? backoffCap : delay;
	}

	public int maxAttempts() {
		return maxAttempts;
	}
}
