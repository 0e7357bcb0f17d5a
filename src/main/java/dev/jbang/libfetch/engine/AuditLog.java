package dev.jbang.libfetch.engine;

import dev.jbang.libfetch.util.FileUtils;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

/**
 * Append-only text record of what happened to each item, one file per kind of run. Every session
 * starts with a header line; earlier sessions are never rewritten. Lines are also passed to the
 * {@value #LOGGER_NAME} logger at debug level.
 */
public class AuditLog implements Closeable {
	public static final String LOGGER_NAME = "audit";
	public static final String FILE_DOWNLOAD_LOG = "file_download.log";
	public static final String COVER_DOWNLOAD_LOG = "cover_download.log";

	private static final Logger logger = LoggerFactory.getLogger(LOGGER_NAME);
	private static final DateTimeFormatter HEADER_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

	private final BufferedWriter writer;

	private AuditLog(BufferedWriter writer) {
		this.writer = writer;
	}

	/** An audit log that only passes lines to the logger */
	public static AuditLog none() {
		return new AuditLog(null);
	}

	/**
	 * Open the log file for appending and write the session header.
	 *
	 * @param session Name of the session in the header, e.g. "FILE DOWNLOAD"
	 */
	public static AuditLog open(Path file, String session, Clock clock) throws IOException {
		Path parent = file.toAbsolutePath().getParent();
		if (parent != null) {
			FileUtils.ensureDirectory(parent);
		}
		// Plain streams: a channel would be closed by the interrupt that stops a run
		BufferedWriter writer = new BufferedWriter(
				new OutputStreamWriter(new FileOutputStream(file.toFile(), true), StandardCharsets.UTF_8));
		AuditLog log = new AuditLog(writer);
		log.writeLine("");
		log.record("=== {} SESSION {} ===", session, LocalDateTime.now(clock).format(HEADER_TIME));
		return log;
	}

	/** Append one line, using SLF4J style {} placeholders */
	public synchronized void record(String format, Object... args) {
		String line = MessageFormatter.arrayFormat(format, args).getMessage();
		logger.debug(line);
		writeLine(line);
	}

	private void writeLine(String line) {
		if (writer == null) {
			return;
		}
		try {
			writer.write(line);
			writer.newLine();
			writer.flush();
		} catch (IOException e) {
			logger.warn("Failed to write audit log: {}", e.getMessage());
		}
	}

	@Override
	public synchronized void close() throws IOException {
		if (writer != null) {
			writer.close();
		}
	}
}
