package org.seqfile.publisher;

/**
 * A bundle that was uploaded and published.
 *
 * @param owner project the bundle was attached to
 * @param filename name the bundle was stored under
 * @param fileId LIMS id of the created file
 * @param fileUri URI of the created file
 * @param fileCount number of sequencing files in the bundle
 * @param published whether the LIMS confirmed the file as published
 */
public record PublishedBundle(Owner owner, String filename, String fileId, String fileUri, int fileCount,
		boolean published) {
}
