package org.seqfile.publisher;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Artifact record: the unit of work as stored in the LIMS, with the sample it derives
 * from and any files attached to it.
 */
public record ArtifactRecord(String id, String uri, String name, @Nullable Reference sample, List<Reference> files) {

	public ArtifactRecord {
		RecordParseException.requireText(id, "limsid", "Artifact");
		RecordParseException.requireText(uri, "uri", "Artifact " + id);
		RecordParseException.requireText(name, "name", "Artifact " + id);
		files = List.copyOf(files);
	}

}
