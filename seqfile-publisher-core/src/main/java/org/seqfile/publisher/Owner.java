package org.seqfile.publisher;

/**
 * The project that owns a unit of work, and the upload destination for its bundle.
 *
 * @param name display name; the project LIMS id when the project has no name
 * @param id project LIMS id
 * @param uri project URI
 */
public record Owner(String name, String id, String uri) {

	public Owner {
		RecordParseException.requireText(id, "limsid", "Project");
		RecordParseException.requireText(name, "name", "Project " + id);
		RecordParseException.requireText(uri, "uri", "Project " + id);
	}

}
