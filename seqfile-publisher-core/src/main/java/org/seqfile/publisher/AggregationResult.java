package org.seqfile.publisher;

import java.util.List;

/**
 * Output of {@link MatchAggregator#aggregate}: one match per unit in unit order, the
 * bundles in order of first owner occurrence, and the identifiers no unit matched.
 */
public record AggregationResult(List<Match> matches, List<Bundle> bundles, List<String> unmatchedGroups,
		ProcessingResult result) {

	public AggregationResult {
		matches = List.copyOf(matches);
		bundles = List.copyOf(bundles);
		unmatchedGroups = List.copyOf(unmatchedGroups);
	}

}
