package dev.jbang.libfetch.session;

import dev.jbang.libfetch.account.Account;

/**
 * Obtains authenticated sessions for accounts. How the login happens (a browser, a captured
 * cookie jar, an API token) is up to the implementation.
 */
public interface SessionProvider {
	/**
	 * Acquire an authenticated session for the given account.
	 *
	 * @param account The account to log in with
	 * @return A session bound to the account
	 * @throws dev.jbang.libfetch.error.AuthenticationException if the credentials are rejected
	 * @throws dev.jbang.libfetch.error.AccountLockedException if the remote side blocked the account
	 * @throws dev.jbang.libfetch.error.TransientException if the login failed for network reasons
	 */
	Session acquire(Account account);
}
