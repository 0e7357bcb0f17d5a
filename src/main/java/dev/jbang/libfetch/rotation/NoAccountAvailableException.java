package dev.jbang.libfetch.rotation;

/**
 * Signals that no account has quota left (or all remaining ones are disqualified). Ends a run
 * normally with a partial-completion report.
 */
public class NoAccountAvailableException extends RuntimeException {

	public NoAccountAvailableException(String message) {
		super(message);
	}
}
