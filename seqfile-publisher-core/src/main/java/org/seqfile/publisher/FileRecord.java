package org.seqfile.publisher;

import org.jspecify.annotations.Nullable;

/**
 * File record: a file stored in the LIMS and the record it is attached to.
 *
 * @param id file LIMS id
 * @param uri file URI
 * @param attachedTo URI of the record the file is attached to
 * @param originalLocation file name as uploaded
 * @param contentLocation storage location of the content
 * @param published whether the file is visible to portal users
 */
public record FileRecord(String id, String uri, @Nullable String attachedTo, @Nullable String originalLocation,
		@Nullable String contentLocation, boolean published) {

	public FileRecord {
		RecordParseException.requireText(id, "limsid", "File");
		RecordParseException.requireText(uri, "uri", "File " + id);
	}

	/**
	 * Name of the file without any directory part of its original location.
	 */
	public String displayName() {
		return originalLocation != null ? FileNames.fileName(originalLocation) : id;
	}

}
