package org.seqfile.publisher;

import java.util.List;

/**
 * Outcome of publishing a set of bundles. The result counts only files in bundles that
 * were both uploaded and published.
 */
public record PublishReport(List<PublishedBundle> published, ProcessingResult result) {

	public PublishReport {
		published = List.copyOf(published);
	}

}
