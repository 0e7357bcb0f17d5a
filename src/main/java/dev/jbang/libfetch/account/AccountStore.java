package dev.jbang.libfetch.account;

import dev.jbang.libfetch.util.JsonUtils;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the account pool and its quota counters. Counters only move through {@link
 * #recordSuccess(String)} and the lazy daily reset, so an account can never go over its daily
 * maximum however many attempts fail or get retried. When backed by a file every change is written
 * back immediately.
 */
public class AccountStore {
	private static final Logger logger = LoggerFactory.getLogger(AccountStore.class);

	private final Map<String, Account> accounts;
	private final Clock clock;
	private final Path accountsFile;

	public AccountStore(List<Account> accounts, Clock clock) {
		this(accounts, clock, null);
	}

	private AccountStore(List<Account> accounts, Clock clock, Path accountsFile) {
		this.accounts = new LinkedHashMap<>();
		this.clock = clock;
		this.accountsFile = accountsFile;
		for (Account account : accounts) {
			validate(account);
			if (this.accounts.putIfAbsent(account.id(), account) != null) {
				throw new IllegalArgumentException("Duplicate account ID: " + account.id());
			}
		}
	}

	/** Load the account pool from a JSON file, changes will be saved back to the same file */
	public static AccountStore load(Path accountsFile, Clock clock) throws IOException {
		List<Account> accounts = JsonUtils.readList(accountsFile, Account.class);
		logger.debug("Loaded {} accounts from {}", accounts.size(), accountsFile);
		return new AccountStore(accounts, clock, accountsFile);
	}

	/**
	 * Returns the accounts that still have quota left today, ordered by id. Accounts whose last
	 * reset lies before {@code today} get their counter reset first.
	 */
	public synchronized List<Account> listUsable(LocalDate today) {
		boolean changed = false;
		List<Account> usable = new ArrayList<>();
		for (Account account : accounts.values()) {
			changed |= applyDailyReset(account, today);
			if (account.isUsable()) {
				usable.add(account);
			}
		}
		if (changed) {
			save();
		}
		usable.sort(Comparator.comparing(Account::id));
		return usable;
	}

	/** Count one confirmed download against the account's quota for today */
	public synchronized void recordSuccess(String accountId) {
		Account account = require(accountId);
		applyDailyReset(account, LocalDate.now(clock));
		if (!account.isUsable()) {
			throw new IllegalStateException("Account " + accountId + " has already reached its daily maximum of "
					+ account.maxDailyDownloads() + " downloads");
		}
		account.incrementDownloads();
		logger.debug(
				"Account {} used {}/{} downloads today",
				accountId,
				account.dailyDownloads(),
				account.maxDailyDownloads());
		save();
	}

	/** Note a failed attempt; quota is unaffected */
	public synchronized void recordFailure(String accountId) {
		Account account = require(accountId);
		account.incrementFailures();
		logger.debug("Account {} has {} failures in this run", accountId, account.failures());
	}

	public synchronized Account get(String accountId) {
		return require(accountId);
	}

	/** Snapshot of all accounts in id order, daily reset applied */
	public synchronized List<Account> all(LocalDate today) {
		boolean changed = false;
		for (Account account : accounts.values()) {
			changed |= applyDailyReset(account, today);
		}
		if (changed) {
			save();
		}
		return accounts.values().stream()
				.sorted(Comparator.comparing(Account::id))
				.toList();
	}

	/** Remaining downloads per account id for today */
	public synchronized Map<String, Integer> remaining(LocalDate today) {
		Map<String, Integer> result = new LinkedHashMap<>();
		for (Account account : all(today)) {
			result.put(account.id(), account.remaining());
		}
		return result;
	}

	public synchronized int size() {
		return accounts.size();
	}

	private Account require(String accountId) {
		Account account = accounts.get(accountId);
		if (account == null) {
			throw new UnknownAccountException(accountId);
		}
		return account;
	}

	private boolean applyDailyReset(Account account, LocalDate today) {
		if (account.lastReset() != null && !account.lastReset().isBefore(today)) {
			return false;
		}
		if (account.dailyDownloads() > 0) {
			logger.info("Resetting daily downloads of account {} (last reset {})", account.id(), account.lastReset());
		}
		account.resetIfNewDay(today);
		return true;
	}

	private void save() {
		if (accountsFile == null) {
			return;
		}
		try {
			JsonUtils.writeAtomically(accountsFile, new ArrayList<>(accounts.values()));
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to save accounts to " + accountsFile, e);
		}
	}

	private static void validate(Account account) {
		if (account.id() == null || account.id().isBlank()) {
			throw new IllegalArgumentException("Account without an ID");
		}
		if (account.maxDailyDownloads() <= 0) {
			throw new IllegalArgumentException("Account " + account.id() + " must allow at least one daily download");
		}
		if (account.dailyDownloads() < 0 || account.dailyDownloads() > account.maxDailyDownloads()) {
			throw new IllegalArgumentException("Account " + account.id() + " has an invalid download count of "
					+ account.dailyDownloads());
		}
	}
}
