package org.seqfile.publisher;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Static helpers for splitting archive entry paths into file name, base name and
 * extension.
 *
 * <p>
 * Both {@code /} and {@code \} are treated as directory separators because archives
 * produced on Windows instruments sometimes carry backslash paths. A leading dot is part
 * of the name, not an extension, so {@code .hidden} has base name {@code .hidden} and no
 * extension.
 */
public final class FileNames {

	private static final Pattern UNSAFE_CHARACTERS = Pattern.compile("[\\\\/:*?\"<>|]");

	private FileNames() {
	}

	/**
	 * Returns the last path segment of an entry path.
	 * @param path entry path, possibly with directory prefix
	 * @return the file name without any directory prefix
	 */
	public static String fileName(String path) {
		int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
		return slash >= 0 ? path.substring(slash + 1) : path;
	}

	/**
	 * Returns the file name without directory prefix and without its final extension.
	 * @param path entry path
	 * @return base name used as a file group identifier
	 */
	public static String baseName(String path) {
		String name = fileName(path);
		int dot = name.lastIndexOf('.');
		return dot > 0 ? name.substring(0, dot) : name;
	}

	/**
	 * Returns the final extension including its dot, e.g. {@code .ab1}.
	 * @param path entry path
	 * @return extension or an empty string if the name has none
	 */
	public static String extension(String path) {
		String name = fileName(path);
		int dot = name.lastIndexOf('.');
		return dot > 0 ? name.substring(dot) : "";
	}

	/**
	 * Case-folds a name for comparison. Grouping and matching both compare names through
	 * this method so that they agree on which names are equal.
	 * @param name file name, base name or unit name
	 * @return the folded name
	 */
	public static String fold(String name) {
		return name.toLowerCase(Locale.ROOT);
	}

	/**
	 * Replaces characters that are invalid on common filesystems with {@code _}.
	 * @param name proposed file name
	 * @return sanitized file name
	 */
	public static String sanitize(String name) {
		return UNSAFE_CHARACTERS.matcher(name).replaceAll("_");
	}

}
