package dev.jbang.libfetch.error;

/** Network failure, timeout or garbled response that may succeed when tried again */
public class TransientException extends FetchException {

	public TransientException(String message) {
		super(message);
	}

	public TransientException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public ErrorKind kind() {
		return ErrorKind.TRANSIENT;
	}
}
