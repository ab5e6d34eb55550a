package org.seqfile.publisher;

/**
 * Thrown when the step or its input artifacts cannot be read. Nothing can be processed
 * without them, so this aborts the run.
 */
public class StepRetrievalException extends RuntimeException {

	private final String stepUri;

	public StepRetrievalException(String stepUri, String message, Throwable cause) {
		super(message, cause);
		this.stepUri = stepUri;
	}

	public String getStepUri() {
		return stepUri;
	}

}
