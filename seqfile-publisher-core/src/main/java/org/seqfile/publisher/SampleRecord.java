package org.seqfile.publisher;

import org.jspecify.annotations.Nullable;

/**
 * Sample record with the project it was submitted under.
 */
public record SampleRecord(String id, String uri, @Nullable String name, @Nullable Reference project) {

	public SampleRecord {
		RecordParseException.requireText(id, "limsid", "Sample");
		RecordParseException.requireText(uri, "uri", "Sample " + id);
	}

}
