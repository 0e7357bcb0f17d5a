package dev.jbang.libfetch.error;

/** A transfer completed but its result is outside the configured bounds */
public class ValidationException extends FetchException {

	public ValidationException(String message) {
		super(message);
	}

	public ValidationException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public ErrorKind kind() {
		return ErrorKind.VALIDATION;
	}
}
