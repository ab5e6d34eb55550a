package org.seqfile.publisher;

/**
 * Thrown when a researcher could not be notified about a published bundle.
 */
public class NotificationException extends RuntimeException {

	private final String projectId;

	public NotificationException(String projectId, String message) {
		super(message);
		this.projectId = projectId;
	}

	public NotificationException(String projectId, String message, Throwable cause) {
		super(message, cause);
		this.projectId = projectId;
	}

	public String getProjectId() {
		return projectId;
	}

}
