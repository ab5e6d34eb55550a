package org.seqfile.publisher;

import org.jspecify.annotations.Nullable;

/**
 * One input-output map of a step: an input artifact and one output generated from it.
 */
public record IoMapping(String inputId, String inputUri, @Nullable String outputId, @Nullable String outputUri,
		@Nullable String outputType, @Nullable String outputGenerationType) {

	public IoMapping {
		RecordParseException.requireText(inputId, "input limsid", "Input-output map");
		RecordParseException.requireText(inputUri, "input uri", "Input-output map");
	}

	/**
	 * Whether the output is a result file shared by all inputs, which is where step-level
	 * attachments such as sequencing archives live.
	 */
	public boolean isSharedResultFile() {
		return outputUri != null && "ResultFile".equals(outputType) && "PerAllInputs".equals(outputGenerationType);
	}

}
