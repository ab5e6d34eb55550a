package org.seqfile.publisher;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when a LIMS API call fails.
 *
 * <p>
 * Carries the HTTP status code and response body when a response was received, so that
 * callers can tell a missing record (404) apart from authentication or server failures,
 * and so that {@link RetryingClarityClient} can decide whether a retry makes sense. A
 * status code of {@code -1} means no HTTP response was involved (I/O failure, or an
 * exception document returned in a successful response).
 */
public class ClarityApiException extends RuntimeException {

	private final int statusCode;

	private final @Nullable String responseBody;

	public ClarityApiException(String message, int statusCode, @Nullable String responseBody) {
		super(message);
		this.statusCode = statusCode;
		this.responseBody = responseBody;
	}

	public ClarityApiException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
		this.responseBody = null;
	}

	public int getStatusCode() {
		return statusCode;
	}

	public @Nullable String getResponseBody() {
		return responseBody;
	}

	public boolean isNotFound() {
		return statusCode == 404;
	}

	/**
	 * Returns true for 4xx responses, which will not succeed when repeated.
	 */
	public boolean isClientError() {
		return statusCode >= 400 && statusCode < 500;
	}

}
