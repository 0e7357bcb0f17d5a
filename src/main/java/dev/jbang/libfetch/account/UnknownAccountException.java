package dev.jbang.libfetch.account;

/** Thrown when an account id is not present in the {@link AccountStore}; a configuration defect */
public class UnknownAccountException extends RuntimeException {

	public UnknownAccountException(String accountId) {
		super("Unknown account ID: " + accountId);
	}
}
