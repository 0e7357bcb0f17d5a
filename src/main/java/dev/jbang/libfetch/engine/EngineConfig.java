package dev.jbang.libfetch.engine;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings of an orchestrator run: where files go, which sizes count as a valid download and how
 * long to pause between items.
 */
public record EngineConfig(Path filesDir, long minFileSize, long maxFileSize, Duration delayBetweenItems) {
	public static final long DEFAULT_MIN_FILE_SIZE = 1000;
	public static final long DEFAULT_MAX_FILE_SIZE = 500L * 1024 * 1024;

	public EngineConfig {
		if (minFileSize < 0 || maxFileSize < minFileSize) {
			throw new IllegalArgumentException(
					"Invalid file size bounds: min " + minFileSize + ", max " + maxFileSize);
		}
		if (delayBetweenItems == null || delayBetweenItems.isNegative()) {
			delayBetweenItems = Duration.ZERO;
		}
	}

	public static EngineConfig defaults(Path filesDir) {
		return new EngineConfig(filesDir, DEFAULT_MIN_FILE_SIZE, DEFAULT_MAX_FILE_SIZE, Duration.ZERO);
	}
}
