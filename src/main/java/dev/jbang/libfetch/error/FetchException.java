package dev.jbang.libfetch.error;

/**
 * Base class for failures of a single fetch attempt, raised either while acquiring a session or
 * while transferring an item. Each subclass maps to exactly one {@link ErrorKind}.
 */
public abstract class FetchException extends RuntimeException {

	protected FetchException(String message) {
		super(message);
	}

	protected FetchException(String message, Throwable cause) {
		super(message, cause);
	}

	/** The kind recorded as the item's last error */
	public abstract ErrorKind kind();
}
