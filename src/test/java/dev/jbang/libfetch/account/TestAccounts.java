package dev.jbang.libfetch.account;

import java.time.LocalDate;

/** Builds accounts with a given download history, as they would be read from accounts.json */
public final class TestAccounts {

	private TestAccounts() {}

	/** An account that has not downloaded anything on the given day */
	public static Account fresh(String id, int maxDailyDownloads, LocalDate today) {
		return used(id, maxDailyDownloads, 0, today);
	}

	/** An account with {@code dailyDownloads} downloads recorded on {@code lastReset} */
	public static Account used(String id, int maxDailyDownloads, int dailyDownloads, LocalDate lastReset) {
		return Account.create(id, "secret", maxDailyDownloads)
				.dailyDownloads(dailyDownloads)
				.lastReset(lastReset);
	}

	/** Mark an account as last reset on the given day, keeping its counters */
	public static Account resetOn(Account account, LocalDate lastReset) {
		return account.lastReset(lastReset);
	}
}
