package dev.jbang.libfetch;

import java.nio.file.Path;

/** Layout of the data directory the commands work on */
public record FetcherPaths(Path dataDir) {
	public static final String DEFAULT_DATA_DIR = "ebooks";

	public Path accountsFile() {
		return dataDir.resolve("accounts.json");
	}

	public Path statusFile() {
		return dataDir.resolve("status.json");
	}

	public Path sessionsDir() {
		return dataDir.resolve("sessions");
	}

	public Path filesDir() {
		return dataDir.resolve("files");
	}

	public Path coversDir() {
		return dataDir.resolve("covers");
	}

	/** Where the append-only download logs are kept */
	public Path logsDir() {
		return dataDir.resolve("logs");
	}
}
