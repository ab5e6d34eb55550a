package org.seqfile.publisher;

import org.jspecify.annotations.Nullable;

/**
 * A link from one LIMS record to another, as found in {@code <sample uri limsid/>} style
 * elements.
 */
public record Reference(String uri, @Nullable String id) {

	public Reference {
		RecordParseException.requireText(uri, "uri", "Reference");
	}

}
