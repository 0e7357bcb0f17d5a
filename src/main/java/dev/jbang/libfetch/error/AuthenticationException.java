package dev.jbang.libfetch.error;

/** The remote source rejected the account's credentials */
public class AuthenticationException extends FetchException {

	public AuthenticationException(String message) {
		super(message);
	}

	public AuthenticationException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public ErrorKind kind() {
		return ErrorKind.AUTHENTICATION;
	}
}
