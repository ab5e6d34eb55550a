package org.seqfile.publisher;

import java.util.List;

/**
 * Outcome of one pipeline run.
 */
public record PipelineResult(String stepUri, List<Match> matches, List<PublishedBundle> bundles,
		ProcessingResult result) {

	public PipelineResult {
		matches = List.copyOf(matches);
		bundles = List.copyOf(bundles);
	}

	public boolean success() {
		return result.success();
	}

}
