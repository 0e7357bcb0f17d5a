package dev.jbang.libfetch.transfer;

import dev.jbang.libfetch.error.AccountLockedException;
import dev.jbang.libfetch.error.AuthenticationException;
import dev.jbang.libfetch.error.PermanentTransferException;
import dev.jbang.libfetch.error.QuotaExhaustedException;
import dev.jbang.libfetch.error.TransientException;
import dev.jbang.libfetch.session.Session;
import dev.jbang.libfetch.util.FileUtils;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Downloads items over HTTP(S), mapping responses onto the fetch error kinds */
public class HttpTransfer implements Transfer {
	private static final Logger logger = LoggerFactory.getLogger(HttpTransfer.class);

	public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);
	static final long MAX_ERROR_PAGE_SIZE = 10_000;
	private static final String USER_AGENT =
			"Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";

	private final HttpClient httpClient;
	private final Duration timeout;

	public HttpTransfer() {
		this(DEFAULT_TIMEOUT);
	}

	public HttpTransfer(Duration timeout) {
		if (timeout == null || timeout.isZero() || timeout.isNegative()) {
			throw new IllegalArgumentException("Timeout must be positive");
		}
		this.httpClient = HttpClient.newBuilder()
				.followRedirects(HttpClient.Redirect.NORMAL)
				.connectTimeout(Duration.ofSeconds(30))
				.build();
		this.timeout = timeout;
	}

	@Override
	public long transfer(Session session, String locator, Path destination) {
		URI uri = toUri(locator);
		Path tempFile = null;
		try {
			FileUtils.ensureDirectory(destination.toAbsolutePath().getParent());
			tempFile = Files.createTempFile(
					destination.toAbsolutePath().getParent(), ".fetch-", ".part");

			HttpResponse<InputStream> response =
					httpClient.send(request(session, uri), HttpResponse.BodyHandlers.ofInputStream());
			try (InputStream body = response.body()) {
				checkStatus(response.statusCode(), locator);
				Files.copy(body, tempFile, StandardCopyOption.REPLACE_EXISTING);
			}

			long size = Files.size(tempFile);
			String contentType = response.headers().firstValue("Content-Type").orElse("");
			if (contentType.contains("text/html") && size < MAX_ERROR_PAGE_SIZE) {
				throw new TransientException("Received an HTML page instead of a file from " + locator);
			}

			FileUtils.moveIntoPlace(tempFile, destination);
			logger.debug("Downloaded {} ({} bytes) to {}", locator, size, destination);
			return size;
		} catch (IOException e) {
			throw new TransientException("Failed to download " + locator + ": " + e.getMessage(), e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new TransientException("Interrupted while downloading " + locator, e);
		} finally {
			deleteQuietly(tempFile);
		}
	}

	private HttpRequest request(Session session, URI uri) {
		HttpRequest.Builder builder = HttpRequest.newBuilder()
				.uri(uri)
				.timeout(timeout)
				.header("User-Agent", USER_AGENT)
				.GET();
		for (Map.Entry<String, String> header : session.headers().entrySet()) {
			builder.header(header.getKey(), header.getValue());
		}
		return builder.build();
	}

	static void checkStatus(int statusCode, String locator) {
		if (statusCode >= 200 && statusCode < 300) {
			return;
		}
		String message = "Failed to download " + locator + " - HTTP status: " + statusCode;
		switch (statusCode) {
			case 401 -> throw new AuthenticationException(message);
			case 403 -> throw new AccountLockedException(message);
			case 429 -> throw new QuotaExhaustedException(message);
			case 404, 410 -> throw new PermanentTransferException(message);
			default -> throw new TransientException(message);
		}
	}

	private static URI toUri(String locator) {
		if (locator == null || locator.isBlank()) {
			throw new PermanentTransferException("Item has no download locator");
		}
		try {
			URI uri = URI.create(locator);
			if (uri.getScheme() == null || uri.getHost() == null) {
				throw new PermanentTransferException("Not an absolute URL: " + locator);
			}
			return uri;
		} catch (IllegalArgumentException e) {
			throw new PermanentTransferException("Invalid URL: " + locator, e);
		}
	}

	private static void deleteQuietly(Path file) {
		if (file == null) {
			return;
		}
		try {
			Files.deleteIfExists(file);
		} catch (IOException e) {
			logger.warn("Failed to delete temporary file {}: {}", file, e.getMessage());
		}
	}
}
