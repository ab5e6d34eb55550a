package org.seqfile.publisher;

import org.jspecify.annotations.Nullable;

/**
 * Project record with a link to the researcher who owns it.
 */
public record ProjectRecord(String id, String uri, @Nullable String name, @Nullable Reference researcher) {

	public ProjectRecord {
		RecordParseException.requireText(id, "limsid", "Project");
		RecordParseException.requireText(uri, "uri", "Project " + id);
	}

	public ProjectRecord(String id, String uri, @Nullable String name) {
		this(id, uri, name, null);
	}

	/**
	 * Name shown to users and used for bundle file names, falling back to the LIMS id.
	 */
	public String displayName() {
		return name != null && !name.isBlank() ? name : id;
	}

	public Owner toOwner() {
		return new Owner(displayName(), id, uri);
	}

}
