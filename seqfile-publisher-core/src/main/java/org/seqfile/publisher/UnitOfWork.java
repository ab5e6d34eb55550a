package org.seqfile.publisher;

/**
 * One distinct input artifact of the step being processed.
 *
 * @param id artifact LIMS id
 * @param name artifact name, matched against file group identifiers
 * @param uri artifact URI
 */
public record UnitOfWork(String id, String name, String uri) {

	public UnitOfWork {
		RecordParseException.requireText(id, "limsid", "Artifact");
		RecordParseException.requireText(name, "name", "Artifact " + id);
		RecordParseException.requireText(uri, "uri", "Artifact " + id);
	}

}
