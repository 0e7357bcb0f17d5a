package dev.jbang.libfetch.account;

import static org.assertj.core.api.Assertions.*;

import java.lang.reflect.Method;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AccountStoreTest {

	@TempDir
	Path tempDir;

	private final Clock clock = Clock.fixed(Instant.parse("2026-10-19T08:30:00Z"), ZoneOffset.UTC);
	private final LocalDate today = LocalDate.of(2026, 10, 19);

	@Test
	void testListUsableIsOrderedById() {
		// Given
		AccountStore store = new AccountStore(
				List.of(
						Account.create("c@example.com", "x", 5).lastReset(today),
						Account.create("a@example.com", "x", 5).lastReset(today),
						Account.create("b@example.com", "x", 5).lastReset(today)),
				clock);

		// When
		List<Account> usable = store.listUsable(today);

		// Then
		assertThat(usable).extracting(Account::id).containsExactly("a@example.com", "b@example.com", "c@example.com");
	}

	@Test
	void testAccountsAtMaximumAreNotUsable() {
		// Given
		AccountStore store = new AccountStore(
				List.of(
						Account.create("a@example.com", "x", 2).dailyDownloads(2).lastReset(today),
						Account.create("b@example.com", "x", 2).dailyDownloads(1).lastReset(today)),
				clock);

		// When
		List<Account> usable = store.listUsable(today);

		// Then
		assertThat(usable).extracting(Account::id).containsExactly("b@example.com");
	}

	@Test
	void testDailyResetOnNewDay() {
		// Given
		Account account = Account.create("a@example.com", "x", 3)
				.dailyDownloads(3)
				.lastReset(today.minusDays(1));
		AccountStore store = new AccountStore(List.of(account), clock);

		// When
		List<Account> usable = store.listUsable(today);

		// Then
		assertThat(usable).containsExactly(account);
		assertThat(account.dailyDownloads()).isZero();
		assertThat(account.lastReset()).isEqualTo(today);
	}

	@Test
	void testNoResetOnSameDay() {
		// Given
		Account account = Account.create("a@example.com", "x", 3).dailyDownloads(3).lastReset(today);
		AccountStore store = new AccountStore(List.of(account), clock);

		// When
		List<Account> usable = store.listUsable(today);

		// Then
		assertThat(usable).isEmpty();
		assertThat(account.dailyDownloads()).isEqualTo(3);
	}

	@Test
	void testRecordSuccessIncrementsCounter() {
		// Given
		AccountStore store = new AccountStore(List.of(Account.create("a@example.com", "x", 3)), clock);

		// When
		store.recordSuccess("a@example.com");
		store.recordSuccess("a@example.com");

		// Then
		Account account = store.get("a@example.com");
		assertThat(account.dailyDownloads()).isEqualTo(2);
		assertThat(account.remaining()).isEqualTo(1);
		assertThat(account.lastReset()).isEqualTo(today);
	}

	@Test
	void testRecordSuccessNeverExceedsMaximum() {
		// Given
		AccountStore store = new AccountStore(
				List.of(Account.create("a@example.com", "x", 1).dailyDownloads(1).lastReset(today)), clock);

		// When/Then
		assertThatThrownBy(() -> store.recordSuccess("a@example.com"))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("daily maximum");
		assertThat(store.get("a@example.com").dailyDownloads()).isEqualTo(1);
	}

	@Test
	void testRecordFailureLeavesQuotaAlone() {
		// Given
		AccountStore store = new AccountStore(List.of(Account.create("a@example.com", "x", 3)), clock);

		// When
		store.recordFailure("a@example.com");
		store.recordFailure("a@example.com");

		// Then
		Account account = store.get("a@example.com");
		assertThat(account.failures()).isEqualTo(2);
		assertThat(account.dailyDownloads()).isZero();
	}

	@Test
	void testUnknownAccount() {
		// Given
		AccountStore store = new AccountStore(List.of(Account.create("a@example.com", "x", 3)), clock);

		// When/Then
		assertThatThrownBy(() -> store.recordSuccess("nobody@example.com"))
				.isInstanceOf(UnknownAccountException.class)
				.hasMessage("Unknown account ID: nobody@example.com");
		assertThatThrownBy(() -> store.recordFailure("nobody@example.com"))
				.isInstanceOf(UnknownAccountException.class);
	}

	@Test
	void testInvalidAccountsAreRejected() {
		assertThatThrownBy(() -> new AccountStore(List.of(Account.create(" ", "x", 3)), clock))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new AccountStore(List.of(Account.create("a@example.com", "x", 0)), clock))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new AccountStore(
						List.of(Account.create("a@example.com", "x", 2), Account.create("a@example.com", "y", 2)),
						clock))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Duplicate");
	}

	@Test
	void testRemainingPerAccount() {
		// Given
		AccountStore store = new AccountStore(
				List.of(
						Account.create("b@example.com", "x", 10).dailyDownloads(4).lastReset(today),
						Account.create("a@example.com", "x", 10).dailyDownloads(9).lastReset(today.minusDays(2))),
				clock);

		// When/Then
		assertThat(store.remaining(today))
				.containsExactly(entry("a@example.com", 10), entry("b@example.com", 6));
	}

	@Test
	void testLoadAndSaveFile() throws Exception {
		// Given
		Path file = tempDir.resolve("accounts.json");
		Files.writeString(file, """
				[
				  {
				    "email": "a@example.com",
				    "password": "secret",
				    "max_daily_downloads": 5,
				    "daily_downloads": 2,
				    "last_reset": "2026-10-19"
				  },
				  {
				    "email": "b@example.com",
				    "password": "other"
				  }
				]
				""");

		// When
		AccountStore store = AccountStore.load(file, clock);
		store.recordSuccess("a@example.com");

		// Then
		assertThat(store.size()).isEqualTo(2);
		assertThat(store.get("b@example.com").maxDailyDownloads()).isEqualTo(Account.DEFAULT_MAX_DAILY_DOWNLOADS);
		AccountStore reloaded = AccountStore.load(file, clock);
		assertThat(reloaded.get("a@example.com").dailyDownloads()).isEqualTo(3);
		assertThat(reloaded.get("a@example.com").secret()).isEqualTo("secret");
		assertThat(Files.readString(file)).contains("\"last_reset\" : \"2026-10-19\"");
	}

	@Test
	void testMissingFileLoadsEmptyStore() throws Exception {
		// When
		AccountStore store = AccountStore.load(tempDir.resolve("missing.json"), clock);

		// Then
		assertThat(store.size()).isZero();
		assertThat(store.listUsable(today)).isEmpty();
	}

	@Test
	void testRandomUsageNeverExceedsQuota() {
		// Given
		Random random = new Random(42);
		List<Account> accounts = new ArrayList<>();
		for (int i = 0; i < 5; i++) {
			accounts.add(Account.create("user" + i + "@example.com", "x", 1 + random.nextInt(4)));
		}
		AccountStore store = new AccountStore(accounts, clock);

		// When
		for (int i = 0; i < 200; i++) {
			List<Account> usable = store.listUsable(today);
			if (usable.isEmpty()) {
				break;
			}
			Account account = usable.get(random.nextInt(usable.size()));
			if (random.nextBoolean()) {
				store.recordSuccess(account.id());
			} else {
				store.recordFailure(account.id());
			}
		}

		// Then
		for (Account account : store.all(today)) {
			assertThat(account.dailyDownloads()).isBetween(0, account.maxDailyDownloads());
		}
		assertThat(store.listUsable(today)).isEmpty();
	}

	@Test
	void testCountersCanOnlyChangeThroughTheStore() {
		// Accounts handed out by the store are live, so nothing outside the package may set counters
		List<String> publicSetters = Arrays.stream(Account.class.getMethods())
				.filter(method -> method.getParameterCount() > 0)
				.filter(method -> method.getDeclaringClass() == Account.class)
				.filter(method -> !method.getName().equals("equals") && !method.getName().equals("create"))
				.map(Method::getName)
				.toList();

		assertThat(publicSetters).isEmpty();
	}
}
