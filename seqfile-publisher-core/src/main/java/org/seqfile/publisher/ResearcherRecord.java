package org.seqfile.publisher;

import org.jspecify.annotations.Nullable;

/**
 * Researcher record: the LIMS user who owns a project and receives notifications about
 * it.
 */
public record ResearcherRecord(String uri, @Nullable String firstName, @Nullable String lastName,
		@Nullable String email) {

	public ResearcherRecord {
		RecordParseException.requireText(uri, "uri", "Researcher");
	}

	public boolean hasEmail() {
		return email != null && !email.isBlank();
	}

	/**
	 * First and last name separated by a space, or null when the record has neither.
	 */
	public @Nullable String fullName() {
		String joined = ((firstName != null ? firstName : "") + " " + (lastName != null ? lastName : "")).trim();
		return joined.isEmpty() ? null : joined;
	}

}
