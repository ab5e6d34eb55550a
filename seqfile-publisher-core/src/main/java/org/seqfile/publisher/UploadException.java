package org.seqfile.publisher;

/**
 * Thrown when a bundle could not be stored in the LIMS or could not be published.
 */
public class UploadException extends RuntimeException {

	private final String filename;

	public UploadException(String filename, String message) {
		super(message);
		this.filename = filename;
	}

	public UploadException(String filename, String message, Throwable cause) {
		super(message, cause);
		this.filename = filename;
	}

	public String getFilename() {
		return filename;
	}

}
