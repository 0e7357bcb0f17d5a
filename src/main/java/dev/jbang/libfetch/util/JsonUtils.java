package dev.jbang.libfetch.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.BufferedWriter;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** Reading and writing of the JSON files the fetcher keeps its state in */
public class JsonUtils {

	private static final ObjectMapper readMapper = JsonMapper.builder()
			.addModule(new JavaTimeModule())
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.build();

	private static final ObjectMapper writeMapper = JsonMapper.builder()
			.addModule(new JavaTimeModule())
			.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
			.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
			.enable(SerializationFeature.INDENT_OUTPUT)
			.build();

	private JsonUtils() {}

	/** Read a JSON array of objects; a missing file reads as an empty list */
	public static <T> List<T> readList(Path file, Class<T> type) throws IOException {
		if (!Files.exists(file)) {
			return List.of();
		}
		return readMapper.readValue(
				file.toFile(), readMapper.getTypeFactory().constructCollectionType(List.class, type));
	}

	/** Read a flat JSON object of string values */
	public static Map<String, String> readStringMap(Path file) throws IOException {
		return readMapper.readValue(
				file.toFile(),
				readMapper.getTypeFactory().constructMapType(Map.class, String.class, String.class));
	}

	/**
	 * Write a value to a temporary sibling of the target file and move it into place, so readers
	 * (and a crash) only ever see the previous or the new content.
	 */
	public static void writeAtomically(Path file, Object value) throws IOException {
		Path parent = file.toAbsolutePath().getParent();
		FileUtils.ensureDirectory(parent);
		Path tempFile = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
		try {
			// A plain stream instead of a channel, state must still be saved after an interrupt
			try (Writer writer = new BufferedWriter(
					new OutputStreamWriter(new FileOutputStream(tempFile.toFile()), StandardCharsets.UTF_8))) {
				writeMapper.writeValue(writer, value);
				writer.write("\n");
			}
			FileUtils.moveIntoPlace(tempFile, file);
		} finally {
			Files.deleteIfExists(tempFile);
		}
	}
}
