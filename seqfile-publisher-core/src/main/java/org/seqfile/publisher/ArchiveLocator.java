package org.seqfile.publisher;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Finds and downloads the sequencing archives attached to a step.
 *
 * <p>
 * Archives are looked for on the step's shared result files (outputs generated once for
 * all inputs), and a file counts as an archive when its original name ends with the
 * archive extension. When a specific archive artifact is given, only the files attached
 * to that artifact are used.
 *
 * <p>
 * A file that cannot be listed or downloaded is reported and skipped.
 */
public class ArchiveLocator {

	private static final Logger logger = LoggerFactory.getLogger(ArchiveLocator.class);

	public static final String DEFAULT_EXTENSION = ".zip";

	private final LimsService limsService;

	private final String extension;

	public ArchiveLocator(LimsService limsService) {
		this(limsService, DEFAULT_EXTENSION);
	}

	public ArchiveLocator(LimsService limsService, String extension) {
		this.limsService = limsService;
		this.extension = extension.toLowerCase(Locale.ROOT);
	}

	/**
	 * Search result: the archives that could be downloaded and a message for each one
	 * that could not.
	 */
	public record ArchiveSearch(List<LocatedArchive> archives, List<String> errors) {

		public ArchiveSearch {
			archives = List.copyOf(archives);
			errors = List.copyOf(errors);
		}

	}

	/**
	 * Locate and download the step's archives.
	 * @param step step details
	 * @param pinnedArtifactId LIMS id of the artifact holding the archive, or null to
	 * search the step's shared result files
	 * @return downloaded archives and per-file errors
	 */
	public ArchiveSearch locate(StepDetails step, @Nullable String pinnedArtifactId) {
		List<LocatedArchive> archives = new ArrayList<>();
		List<String> errors = new ArrayList<>();

		if (pinnedArtifactId != null) {
			logger.info("Using archive attached to artifact {}", pinnedArtifactId);
			try {
				for (Reference file : limsService.findFilesForArtifact(pinnedArtifactId)) {
					download(file.uri(), false, archives, errors);
				}
			}
			catch (ClarityApiException | RecordParseException e) {
				errors.add("Could not list files of artifact " + pinnedArtifactId + ": " + e.getMessage());
			}
		}
		else {
			List<String> outputs = step.sharedResultFileUris();
			logger.info("Searching {} shared result files for {} archives", outputs.size(), extension);
			for (String outputUri : outputs) {
				try {
					for (Reference file : limsService.getArtifact(outputUri).files()) {
						download(file.uri(), true, archives, errors);
					}
				}
				catch (ClarityApiException | RecordParseException e) {
					errors.add("Could not read result file " + outputUri + ": " + e.getMessage());
				}
			}
		}

		for (String error : errors) {
			logger.error(error);
		}
		logger.info("Located {} archive(s)", archives.size());
		return new ArchiveSearch(archives, errors);
	}

	private void download(String fileUri, boolean requireExtension, List<LocatedArchive> archives,
			List<String> errors) {
		try {
			FileRecord file = limsService.getFile(fileUri);
			String name = file.displayName();
			if (requireExtension && !name.toLowerCase(Locale.ROOT).endsWith(extension)) {
				logger.debug("Ignoring attached file {} ({})", name, file.id());
				return;
			}
			byte[] data = limsService.downloadFile(file.uri());
			logger.info("Downloaded archive {} ({}, {} bytes)", name, file.id(), data.length);
			archives.add(new LocatedArchive(file.id(), file.uri(), name, data));
		}
		catch (ClarityApiException | RecordParseException e) {
			errors.add("Could not download archive " + fileUri + ": " + e.getMessage());
		}
	}

}
