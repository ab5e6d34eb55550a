package org.seqfile.publisher;

import org.jspecify.annotations.Nullable;

/**
 * Parameters for one pipeline run.
 *
 * @param stepUri URI of the step whose archive should be distributed
 * @param zipArtifactId LIMS id of the artifact holding the archive, or null to search the
 * step's shared result files
 * @param dryRun if true, bundles are built but not uploaded
 * @param sendEmails if true, the researcher of each published project is notified
 */
public record PipelineRequest(String stepUri, @Nullable String zipArtifactId, boolean dryRun, boolean sendEmails) {

	public PipelineRequest {
		if (stepUri == null || stepUri.isBlank()) {
			throw new IllegalArgumentException("stepUri is required");
		}
	}

	public PipelineRequest(String stepUri, @Nullable String zipArtifactId, boolean dryRun) {
		this(stepUri, zipArtifactId, dryRun, false);
	}

	public static PipelineRequest forStep(String stepUri) {
		return new PipelineRequest(stepUri, null, false, false);
	}

}
