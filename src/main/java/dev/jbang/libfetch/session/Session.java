package dev.jbang.libfetch.session;

import java.time.Instant;
import java.util.Map;

/**
 * An authenticated session for exactly one account. The headers are sent with every transfer made
 * through the session.
 */
public record Session(String accountId, Instant createdAt, Map<String, String> headers) {
	public static final String ANONYMOUS = "anonymous";

	public Session {
		headers = Map.copyOf(headers);
	}

	public static Session of(String accountId, Instant createdAt) {
		return new Session(accountId, createdAt, Map.of());
	}

	/** A session without login, for public resources such as cover images */
	public static Session anonymous(Instant createdAt) {
		return of(ANONYMOUS, createdAt);
	}
}
