package dev.jbang.libfetch.util;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** Utility class for file operations */
public class FileUtils {
	public static final int MAX_FILENAME_LENGTH = 160;
	public static final String FILENAME_SEPARATOR = " - ";

	private static final Pattern INVALID_CHARS = Pattern.compile("[<>:\"/\\\\|?*\\p{Cntrl}]");
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	public static final String DEFAULT_IMAGE_EXTENSION = "jpg";
	private static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif", "webp");

	private FileUtils() {}

	/** Ensure a directory exists, creating it if necessary */
	public static void ensureDirectory(Path directory) throws IOException {
		if (!Files.exists(directory)) {
			Files.createDirectories(directory);
		}
	}

	/**
	 * Build a file name of the form "title - author" that is safe on all common file systems.
	 * Names longer than {@link #MAX_FILENAME_LENGTH} are cut at the last word boundary.
	 */
	public static String sanitizeFilename(String title, String author) {
		String name = (blankToUnknown(title) + FILENAME_SEPARATOR + blankToUnknown(author));
		name = INVALID_CHARS.matcher(name).replaceAll("");
		name = WHITESPACE.matcher(name).replaceAll(" ").strip();
		if (name.length() > MAX_FILENAME_LENGTH) {
			name = name.substring(0, MAX_FILENAME_LENGTH);
			int lastSpace = name.lastIndexOf(' ');
			if (lastSpace > 0) {
				name = name.substring(0, lastSpace);
			}
			name = name.strip();
		}
		return name;
	}

	/** Append the item id to a file name, for items whose plain name is already taken */
	public static String withIdSuffix(String baseName, String id) {
		String safeId = INVALID_CHARS.matcher(id).replaceAll("_");
		return baseName + " (" + safeId + ")";
	}

	/**
	 * The image type of a URL, taken from the extension of its last path segment, lower-cased and
	 * without the dot. Anything that is not a known image extension gives {@value
	 * #DEFAULT_IMAGE_EXTENSION}.
	 */
	public static String imageExtension(String url) {
		if (url == null || url.isBlank()) {
			return DEFAULT_IMAGE_EXTENSION;
		}
		String path = url;
		int end = indexOfAny(path, '?', '#');
		if (end >= 0) {
			path = path.substring(0, end);
		}
		String segment = path.substring(path.lastIndexOf('/') + 1);
		int dot = segment.lastIndexOf('.');
		if (dot < 0) {
			return DEFAULT_IMAGE_EXTENSION;
		}
		String extension = segment.substring(dot + 1).toLowerCase(Locale.ROOT);
		return IMAGE_EXTENSIONS.contains(extension) ? extension : DEFAULT_IMAGE_EXTENSION;
	}

	/** Move a finished file to its final location, replacing anything already there */
	public static void moveIntoPlace(Path source, Path target) throws IOException {
		try {
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
		} catch (AtomicMoveNotSupportedException e) {
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	private static int indexOfAny(String value, char first, char second) {
		int a = value.indexOf(first);
		int b = value.indexOf(second);
		if (a < 0) return b;
		if (b < 0) return a;
		return Math.min(a, b);
	}

	private static String blankToUnknown(String value) {
		return value == null || value.isBlank() ? "Unknown" : value;
	}
}
