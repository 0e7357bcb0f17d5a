package dev.jbang.libfetch.error;

/** The item cannot be fetched at all, for instance because it no longer exists remotely */
public class PermanentTransferException extends FetchException {

	public PermanentTransferException(String message) {
		super(message);
	}

	public PermanentTransferException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public ErrorKind kind() {
		return ErrorKind.PERMANENT;
	}
}
