package org.seqfile.publisher;

import java.util.List;

/**
 * Tells a project's researcher that sequencing files have been published to the project.
 */
public interface NotificationService {

	/**
	 * Send a notification about one published bundle.
	 * @param bundle the published bundle
	 * @param fileNames names of the sequencing files inside the bundle
	 * @throws NotificationException if the recipient cannot be determined or the message
	 * cannot be delivered
	 */
	void notifyPublished(PublishedBundle bundle, List<String> fileNames);

}
