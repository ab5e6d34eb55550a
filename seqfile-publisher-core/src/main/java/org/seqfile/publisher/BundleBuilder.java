package org.seqfile.publisher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes each {@link Bundle} as a single archive named after its owner.
 *
 * <p>
 * Entries keep their original file names without any directory prefix. Every file of the
 * bundle is written, in bundle order. When several matched groups contribute a file with
 * the same name, each payload becomes its own entry and the name is reported in
 * {@link BundleArchive#duplicateNames()}.
 */
public class BundleBuilder {

	private static final Logger logger = LoggerFactory.getLogger(BundleBuilder.class);

	public static final String DEFAULT_SUFFIX = "_sequencing_files.zip";

	private final ArchiveService archiveService;

	private final String suffix;

	public BundleBuilder(ArchiveService archiveService) {
		this(archiveService, DEFAULT_SUFFIX);
	}

	public BundleBuilder(ArchiveService archiveService, String suffix) {
		this.archiveService = archiveService;
		this.suffix = suffix;
	}

	/**
	 * Archive one bundle.
	 * @param bundle files for one owner
	 * @return the archive and what went into it
	 * @throws ArchiveException if the archive cannot be written
	 */
	public BundleArchive build(Bundle bundle) {
		Set<String> seen = new HashSet<>();
		Set<String> duplicates = new LinkedHashSet<>();
		List<String> names = bundle.files().stream().map(ArchiveMember::filename).toList();

		for (String name : names) {
			if (!seen.add(name) && duplicates.add(name)) {
				logger.warn("File name {} occurs more than once in bundle for project {}; writing every copy", name,
						bundle.owner().name());
			}
		}

		String filename = bundle.owner().name() + suffix;
		byte[] data = archiveService.createArchive(bundle.files());
		logger.info("Created {} with {} files ({} bytes)", filename, names.size(), data.length);
		return new BundleArchive(bundle.owner(), filename, data, names, List.copyOf(duplicates));
	}

}
