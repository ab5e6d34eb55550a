package org.seqfile.publisher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Uploads bundle archives to their owning projects and publishes them.
 *
 * <p>
 * Each bundle is handled on its own: a failed upload or publish is recorded as an error,
 * its files are not counted, and the remaining bundles are still processed. Nothing is
 * rolled back.
 */
public class BundlePublisher {

	private static final Logger logger = LoggerFactory.getLogger(BundlePublisher.class);

	static final String CONTENT_TYPE = "application/zip";

	private final LimsService limsService;

	public BundlePublisher(LimsService limsService) {
		this.limsService = limsService;
	}

	/**
	 * Upload and publish bundles.
	 * @param archives bundle archives in bundle order
	 * @param dryRun if true, only log what would be uploaded
	 * @return published bundles and the stage result
	 */
	public PublishReport publish(List<BundleArchive> archives, boolean dryRun) {
		List<PublishedBundle> published = new ArrayList<>();
		List<String> errors = new ArrayList<>();
		int filesAttached = 0;

		for (BundleArchive archive : archives) {
			String filename = FileNames.sanitize(archive.filename());
			Owner owner = archive.owner();

			if (dryRun) {
				logger.info("DRY RUN: Would upload {} ({} files, {} bytes) to project {} ({})", filename,
						archive.fileCount(), archive.data().length, owner.name(), owner.id());
				continue;
			}

			try {
				PublishedBundle bundle = uploadAndPublish(archive, filename);
				published.add(bundle);
				filesAttached += bundle.fileCount();
				logger.info("Published {} to project {} ({} files)", filename, owner.name(), bundle.fileCount());
			}
			catch (UploadException e) {
				logger.error("Failed to publish {} to project {}: {}", filename, owner.name(), e.getMessage());
				errors.add("Upload failed for " + filename + " (project " + owner.id() + "): " + e.getMessage());
			}
		}

		return new PublishReport(published, new ProcessingResult(0, 0, filesAttached, errors, List.of()));
	}

	private PublishedBundle uploadAndPublish(BundleArchive archive, String filename) {
		Owner owner = archive.owner();
		FileRecord file;
		try {
			file = limsService.uploadFile(owner.uri(), filename, archive.data(), CONTENT_TYPE);
		}
		catch (ClarityApiException | RecordParseException e) {
			throw new UploadException(filename, "upload rejected: " + e.getMessage(), e);
		}

		FileRecord updated;
		try {
			updated = limsService.publishFile(file.uri());
		}
		catch (ClarityApiException | RecordParseException e) {
			throw new UploadException(filename, "uploaded as " + file.id() + " but not published: " + e.getMessage(),
					e);
		}
		if (!updated.published()) {
			throw new UploadException(filename, "uploaded as " + file.id() + " but the LIMS did not confirm publishing");
		}

		return new PublishedBundle(owner, filename, file.id(), file.uri(), archive.fileCount(), true);
	}

}
