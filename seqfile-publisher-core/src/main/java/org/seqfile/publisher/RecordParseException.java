package org.seqfile.publisher;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a LIMS response cannot be turned into a typed record, either because the
 * XML is malformed or because a required field is missing.
 */
public class RecordParseException extends RuntimeException {

	public RecordParseException(String message) {
		super(message);
	}

	public RecordParseException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * Returns {@code value} if it has text, otherwise fails.
	 * @param value field value, possibly null or blank
	 * @param field field name used in the error message
	 * @param record record type used in the error message
	 * @return the non-blank value
	 * @throws RecordParseException if the value is null or blank
	 */
	public static String requireText(@Nullable String value, String field, String record) {
		if (value == null || value.isBlank()) {
			throw new RecordParseException(record + " is missing required field '" + field + "'");
		}
		return value;
	}

}
