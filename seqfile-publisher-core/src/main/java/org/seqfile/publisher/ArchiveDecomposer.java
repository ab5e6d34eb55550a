package org.seqfile.publisher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Splits a sequencing archive into {@link FileGroup}s keyed by base name.
 *
 * <p>
 * Files produced for one sample share a base name and differ only in extension (trace,
 * sequence text, quality report), so grouping by base name keeps them together through
 * matching and bundling.
 *
 * <ul>
 * <li>Directory entries and entries whose path contains an OS metadata marker (by
 * default {@code __MACOSX} and {@code .DS_Store}) are skipped.</li>
 * <li>Grouping ignores case; the identifier keeps the case of the first file seen.</li>
 * <li>Groups are returned in order of first occurrence, members in archive order.</li>
 * <li>Member filenames are stored without their directory prefix.</li>
 * </ul>
 */
public class ArchiveDecomposer {

	private static final Logger logger = LoggerFactory.getLogger(ArchiveDecomposer.class);

	public static final List<String> DEFAULT_METADATA_MARKERS = List.of("__MACOSX", ".DS_Store");

	private final ArchiveService archiveService;

	private final List<String> metadataMarkers;

	public ArchiveDecomposer(ArchiveService archiveService) {
		this(archiveService, DEFAULT_METADATA_MARKERS);
	}

	public ArchiveDecomposer(ArchiveService archiveService, List<String> metadataMarkers) {
		this.archiveService = archiveService;
		this.metadataMarkers = List.copyOf(metadataMarkers);
	}

	/**
	 * Decompose an archive into file groups.
	 * @param archive raw archive bytes
	 * @return unmodifiable map from group identifier to group, in first-occurrence order
	 * @throws ArchiveException if the archive is corrupt or unreadable
	 */
	public Map<String, FileGroup> decompose(byte[] archive) {
		List<ArchiveMember> entries = archiveService.readEntries(archive);

		// folded identifier -> identifier as first seen
		Map<String, String> identifiers = new LinkedHashMap<>();
		Map<String, List<ArchiveMember>> membersByKey = new LinkedHashMap<>();
		Map<String, Integer> extensionCounts = new TreeMap<>();
		int skipped = 0;

		for (ArchiveMember entry : entries) {
			if (entry.isDirectory() || isMetadata(entry.filename())) {
				skipped++;
				continue;
			}

			String filename = FileNames.fileName(entry.filename());
			String identifier = FileNames.baseName(filename);
			String key = FileNames.fold(identifier);

			identifiers.putIfAbsent(key, identifier);
			membersByKey.computeIfAbsent(key, k -> new ArrayList<>()).add(new ArchiveMember(filename, entry.data()));
			extensionCounts.merge(FileNames.extension(filename), 1, Integer::sum);
		}

		Map<String, FileGroup> groups = new LinkedHashMap<>();
		membersByKey.forEach((key, members) -> {
			String identifier = identifiers.get(key);
			groups.put(identifier, new FileGroup(identifier, members));
		});

		logSummary(entries.size(), skipped, extensionCounts, groups.size());
		return Collections.unmodifiableMap(groups);
	}

	/**
	 * Merge the groups of several archives. A group from a later archive replaces an
	 * earlier group with the same identifier (ignoring case), but keeps the position at
	 * which the identifier first appeared.
	 * @param archives group maps in archive order
	 * @return unmodifiable merged map in first-occurrence order
	 */
	public static Map<String, FileGroup> merge(List<Map<String, FileGroup>> archives) {
		Map<String, FileGroup> byKey = new LinkedHashMap<>();
		for (Map<String, FileGroup> groups : archives) {
			for (FileGroup group : groups.values()) {
				String key = FileNames.fold(group.identifier());
				if (byKey.containsKey(key)) {
					logger.warn("File group '{}' appears in more than one archive; using the later one",
							group.identifier());
				}
				byKey.put(key, group);
			}
		}

		Map<String, FileGroup> merged = new LinkedHashMap<>();
		byKey.values().forEach(group -> merged.put(group.identifier(), group));
		return Collections.unmodifiableMap(merged);
	}

	private boolean isMetadata(String path) {
		for (String marker : metadataMarkers) {
			if (path.contains(marker)) {
				return true;
			}
		}
		return false;
	}

	private void logSummary(int entryCount, int skipped, Map<String, Integer> extensionCounts, int groupCount) {
		logger.info("Found {} files in archive ({} of {} entries skipped as directories or system files)",
				entryCount - skipped, skipped, entryCount);
		if (!extensionCounts.isEmpty()) {
			logger.info("File types found:");
			extensionCounts.forEach((ext, count) -> logger.info("  {}: {} files", ext.isEmpty() ? "(no extension)" : ext,
					count));
		}
		logger.info("Grouped into {} unique base names", groupCount);
	}

}
