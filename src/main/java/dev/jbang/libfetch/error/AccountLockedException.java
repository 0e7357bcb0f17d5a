package dev.jbang.libfetch.error;

/** The remote source has blocked the account; it must not be used again during this run */
public class AccountLockedException extends FetchException {

	public AccountLockedException(String message) {
		super(message);
	}

	public AccountLockedException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public ErrorKind kind() {
		return ErrorKind.ACCOUNT_LOCKED;
	}
}
