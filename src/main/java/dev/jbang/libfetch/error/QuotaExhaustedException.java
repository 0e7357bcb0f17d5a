package dev.jbang.libfetch.error;

/** The remote source reports that the account has no downloads left today */
public class QuotaExhaustedException extends FetchException {

	public QuotaExhaustedException(String message) {
		super(message);
	}

	public QuotaExhaustedException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public ErrorKind kind() {
		return ErrorKind.QUOTA_EXHAUSTED;
	}
}
