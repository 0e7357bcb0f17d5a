package dev.jbang.libfetch.session;

import dev.jbang.libfetch.account.Account;
import dev.jbang.libfetch.error.AccountLockedException;
import dev.jbang.libfetch.error.AuthenticationException;
import dev.jbang.libfetch.error.TransientException;
import dev.jbang.libfetch.util.JsonUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds sessions from cookie jars captured by an external login tool. Each account has a file
 * {@code <account-id>.json} in the sessions directory holding a flat JSON object of cookie names to
 * values. A jar that contains {@code "__locked": "true"} marks an account the remote side blocked.
 */
public class CookieSessionProvider implements SessionProvider {
	private static final Logger logger = LoggerFactory.getLogger(CookieSessionProvider.class);

	public static final String LOCKED_MARKER = "__locked";

	private final Path sessionsDir;
	private final Clock clock;

	public CookieSessionProvider(Path sessionsDir, Clock clock) {
		this.sessionsDir = sessionsDir;
		this.clock = clock;
	}

	@Override
	public Session acquire(Account account) {
		Path cookieFile = cookieFile(account);
		if (!Files.isRegularFile(cookieFile)) {
			throw new AuthenticationException("No captured session for account " + account.id() + " at " + cookieFile);
		}

		Map<String, String> cookies;
		try {
			cookies = JsonUtils.readStringMap(cookieFile);
		} catch (IOException e) {
			throw new TransientException("Failed to read session for account " + account.id(), e);
		}

		if ("true".equalsIgnoreCase(cookies.get(LOCKED_MARKER))) {
			throw new AccountLockedException("Account " + account.id() + " is locked by the remote source");
		}
		if (cookies.isEmpty()) {
			throw new AuthenticationException("Captured session for account " + account.id() + " is empty");
		}

		String cookieHeader = cookies.entrySet().stream()
				.map(e -> e.getKey() + "=" + e.getValue())
				.collect(Collectors.joining("; "));
		logger.debug("Loaded {} cookies for account {}", cookies.size(), account.id());
		return new Session(account.id(), clock.instant(), Map.of("Cookie", cookieHeader));
	}

	Path cookieFile(Account account) {
		String safeId = account.id().replaceAll("[^A-Za-z0-9@._-]", "_");
		return sessionsDir.resolve(safeId + ".json");
	}
}
