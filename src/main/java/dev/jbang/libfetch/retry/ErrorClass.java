package dev.jbang.libfetch.retry;

/** How the engine reacts to a failed attempt */
public enum ErrorClass {
	/** Worth trying again on the same account after a delay */
	TRANSIENT,
	/** Will never succeed, the item fails right away */
	PERMANENT,
	/** The account is out of quota remotely, retry on another account */
	QUOTA_EXHAUSTED,
	/** The account could not log in, retry on another account */
	AUTH_FAILURE
}
