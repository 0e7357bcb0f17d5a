package dev.jbang.libfetch.rotation;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-run rotation bookkeeping. One instance belongs to one worker; it is handed to every {@link
 * RotationPolicy} call instead of living in a global.
 */
public class RotationState {

	public enum Phase {
		NO_ACTIVE_ACCOUNT,
		ACTIVE,
		EXHAUSTED
	}

	private Phase phase = Phase.NO_ACTIVE_ACCOUNT;
	private String activeAccountId;
	private int successesSinceRotation;
	private int consecutiveFailures;
	private boolean rotationForced;
	private final Set<String> disqualified = new LinkedHashSet<>();
	private final Map<String, Integer> authFailures = new HashMap<>();

	public Phase phase() {
		return phase;
	}

	public String activeAccountId() {
		return activeAccountId;
	}

	public int successesSinceRotation() {
		return successesSinceRotation;
	}

	public int consecutiveFailures() {
		return consecutiveFailures;
	}

	public boolean rotationForced() {
		return rotationForced;
	}

	public boolean isDisqualified(String accountId) {
		return disqualified.contains(accountId);
	}

	public Set<String> disqualified() {
		return Collections.unmodifiableSet(disqualified);
	}

	void activate(String accountId) {
		phase = Phase.ACTIVE;
		activeAccountId = accountId;
		successesSinceRotation = 0;
		consecutiveFailures = 0;
		rotationForced = false;
	}

	void exhaust() {
		phase = Phase.EXHAUSTED;
		activeAccountId = null;
		successesSinceRotation = 0;
		consecutiveFailures = 0;
		rotationForced = false;
	}

	void countSuccess() {
		successesSinceRotation++;
		consecutiveFailures = 0;
		if (activeAccountId != null) {
			authFailures.remove(activeAccountId);
		}
	}

	void countFailure() {
		consecutiveFailures++;
	}

	int countAuthFailure() {
		return authFailures.merge(activeAccountId, 1, Integer::sum);
	}

	void forceRotation() {
		rotationForced = true;
	}

	void disqualifyActive() {
		if (activeAccountId != null) {
			disqualified.add(activeAccountId);
		}
	}

	@Override
	public String toString() {
		return "RotationState{phase=" + phase + ", active=" + activeAccountId + ", successes="
				+ successesSinceRotation + ", failures=" + consecutiveFailures + ", forced=" + rotationForced
				+ ", disqualified=" + disqualified + '}';
	}
}
