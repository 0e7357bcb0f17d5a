package dev.jbang.libfetch.rotation;

import dev.jbang.libfetch.account.Account;
import dev.jbang.libfetch.account.AccountStore;
import dev.jbang.libfetch.error.ErrorKind;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which account serves the next item. Selection is sticky: the active account is kept
 * until it has served {@code rotationThreshold} items, runs out of quota, or fails {@code
 * failureThreshold} times in a row. Rotation then moves to the next usable account in id order,
 * wrapping around.
 */
public class RotationPolicy {
	private static final Logger logger = LoggerFactory.getLogger(RotationPolicy.class);

	public static final int DEFAULT_ROTATION_THRESHOLD = 10;
	public static final int DEFAULT_FAILURE_THRESHOLD = 3;
	static final int AUTH_FAILURES_BEFORE_DISQUALIFY = 2;

	private final int rotationThreshold;
	private final int failureThreshold;

	public RotationPolicy() {
		this(DEFAULT_ROTATION_THRESHOLD, DEFAULT_FAILURE_THRESHOLD);
	}

	public RotationPolicy(int rotationThreshold, int failureThreshold) {
		if (rotationThreshold <= 0 || failureThreshold <= 0) {
			throw new IllegalArgumentException("Rotation and failure thresholds must be positive");
		}
		this.rotationThreshold = rotationThreshold;
		this.failureThreshold = failureThreshold;
	}

	/**
	 * Pick the account to use for the next attempt.
	 *
	 * @param store The account pool
	 * @param state The rotation state of the calling worker, updated in place
	 * @param today The current date, used for the daily quota reset
	 * @return The account to use
	 * @throws NoAccountAvailableException if no account can be used any more in this run
	 */
	public Account select(AccountStore store, RotationState state, LocalDate today) {
		List<Account> candidates = store.listUsable(today).stream()
				.filter(a -> !state.isDisqualified(a.id()))
				.toList();

		String activeId = state.activeAccountId();
		if (state.phase() == RotationState.Phase.ACTIVE && !state.rotationForced()) {
			if (state.successesSinceRotation() < rotationThreshold) {
				for (Account account : candidates) {
					if (account.id().equals(activeId)) {
						return account;
					}
				}
			}
		}

		if (candidates.isEmpty()) {
			state.exhaust();
			throw new NoAccountAvailableException("No usable account left (" + store.size() + " accounts, "
					+ state.disqualified().size() + " disqualified)");
		}

		Account next = nextAfter(candidates, activeId);
		if (activeId == null) {
			logger.info("Using account {}", next.id());
		} else if (next.id().equals(activeId)) {
			logger.info("No other account available, staying with {}", activeId);
		} else {
			logger.info(
					"Rotating from account {} to {} after {} downloads and {} consecutive failures",
					activeId,
					next.id(),
					state.successesSinceRotation(),
					state.consecutiveFailures());
		}
		state.activate(next.id());
		return next;
	}

	public void onSuccess(RotationState state) {
		state.countSuccess();
	}

	/**
	 * Record a failed attempt made with the active account.
	 *
	 * @param state The rotation state of the calling worker
	 * @param kind What went wrong
	 */
	public void onFailure(RotationState state, ErrorKind kind) {
		state.countFailure();
		switch (kind) {
			case ACCOUNT_LOCKED -> {
				logger.warn("Account {} is locked, not using it again in this run", state.activeAccountId());
				state.disqualifyActive();
				state.forceRotation();
			}
			case QUOTA_EXHAUSTED -> {
				logger.warn("Account {} has no remote quota left, not using it again in this run", state.activeAccountId());
				state.disqualifyActive();
				state.forceRotation();
			}
			case AUTHENTICATION -> {
				int authFailures = state.countAuthFailure();
				if (authFailures >= AUTH_FAILURES_BEFORE_DISQUALIFY) {
					logger.warn(
							"Account {} failed to authenticate {} times, not using it again in this run",
							state.activeAccountId(),
							authFailures);
					state.disqualifyActive();
				}
				state.forceRotation();
			}
			default -> {
				if (state.consecutiveFailures() >= failureThreshold) {
					logger.info(
							"Account {} failed {} times in a row, rotating",
							state.activeAccountId(),
							state.consecutiveFailures());
					state.forceRotation();
				}
			}
		}
	}

	public int rotationThreshold() {
		return rotationThreshold;
	}

	public int failureThreshold() {
		return failureThreshold;
	}

	private static Account nextAfter(List<Account> candidates, String activeId) {
		if (activeId != null) {
			for (Account account : candidates) {
				if (account.id().compareTo(activeId) > 0) {
					return account;
				}
			}
		}
		return candidates.get(0);
	}
}
