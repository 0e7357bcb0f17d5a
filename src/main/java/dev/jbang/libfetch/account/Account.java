package dev.jbang.libfetch.account;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.LocalDate;
import java.util.Objects;

/** A credentialed identity on the remote source together with its daily download quota */
@JsonPropertyOrder({"email", "password", "max_daily_downloads", "daily_downloads", "last_reset"})
public class Account {
	public static final int DEFAULT_MAX_DAILY_DOWNLOADS = 10;

	@JsonProperty("email")
	private String id;

	@JsonProperty("password")
	private String secret;

	@JsonProperty("max_daily_downloads")
	private int maxDailyDownloads;

	@JsonProperty("daily_downloads")
	private int dailyDownloads;

	@JsonProperty("last_reset")
	private LocalDate lastReset;

	@JsonIgnore
	private transient int failures;

	public Account() {
		maxDailyDownloads = DEFAULT_MAX_DAILY_DOWNLOADS;
	}

	/** A fresh account with no downloads recorded; counters only change through {@link AccountStore} */
	public static Account create(String id, String secret, int maxDailyDownloads) {
		return new Account().id(id).secret(secret).maxDailyDownloads(maxDailyDownloads);
	}

	public String id() {
		return id;
	}

	Account id(String id) {
		this.id = id;
		return this;
	}

	public String secret() {
		return secret;
	}

	Account secret(String secret) {
		this.secret = secret;
		return this;
	}

	public int maxDailyDownloads() {
		return maxDailyDownloads;
	}

	Account maxDailyDownloads(int maxDailyDownloads) {
		this.maxDailyDownloads = maxDailyDownloads;
		return this;
	}

	public int dailyDownloads() {
		return dailyDownloads;
	}

	Account dailyDownloads(int dailyDownloads) {
		this.dailyDownloads = dailyDownloads;
		return this;
	}

	public LocalDate lastReset() {
		return lastReset;
	}

	Account lastReset(LocalDate lastReset) {
		this.lastReset = lastReset;
		return this;
	}

	/** Failures recorded against this account during the current run */
	public int failures() {
		return failures;
	}

	@JsonIgnore
	public int remaining() {
		return Math.max(0, maxDailyDownloads - dailyDownloads);
	}

	@JsonIgnore
	public boolean isUsable() {
		return dailyDownloads < maxDailyDownloads;
	}

	// Package-private mutators, only AccountStore changes counters

	void resetIfNewDay(LocalDate today) {
		if (lastReset == null || lastReset.isBefore(today)) {
			dailyDownloads = 0;
			lastReset = today;
		}
	}

	void incrementDownloads() {
		dailyDownloads++;
	}

	void incrementFailures() {
		failures++;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Account that = (Account) o;
		return Objects.equals(id, that.id);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id);
	}

	@Override
	public String toString() {
		// Never include the secret
		return "Account{" + "id='" + id + '\'' + ", dailyDownloads=" + dailyDownloads + ", maxDailyDownloads="
				+ maxDailyDownloads + ", lastReset=" + lastReset + '}';
	}
}
