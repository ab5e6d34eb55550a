package org.seqfile.publisher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Decorator that adds automatic retry with exponential backoff to a
 * {@link ClarityClient}.
 *
 * <p>
 * Only idempotent calls are retried: {@code get}, {@code getBytes} and {@code put}. A
 * repeated {@code post} or {@code upload} could create a second storage location or
 * file record, so those run exactly once. Client errors (4xx) are never retried; server
 * errors (5xx) and I/O failures are.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * ClarityClient client = RetryingClarityClient.builder()
 *     .wrapping(new ClarityHttpClient(baseUri, username, password))
 *     .maxRetries(5)
 *     .initialDelay(Duration.ofSeconds(2))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingClarityClient implements ClarityClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingClarityClient.class);

	private final ClarityClient delegate;

	private final int maxRetries;

	private final long initialDelayMs;

	private RetryingClarityClient(Builder builder) {
		this.delegate = builder.delegate;
		this.maxRetries = builder.maxRetries;
		this.initialDelayMs = builder.initialDelayMs;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String get(String uri) {
		return executeWithRetry(() -> delegate.get(uri), "GET " + uri);
	}

	@Override
	public byte[] getBytes(String uri) {
		return executeWithRetry(() -> delegate.getBytes(uri), "GET " + uri);
	}

	@Override
	public String post(String uri, String xml) {
		return delegate.post(uri, xml);
	}

	@Override
	public String put(String uri, String xml) {
		return executeWithRetry(() -> delegate.put(uri, xml), "PUT " + uri);
	}

	@Override
	public String upload(String uri, String filename, byte[] content, String contentType) {
		return delegate.upload(uri, filename, content, contentType);
	}

	private <T> T executeWithRetry(RequestSupplier<T> supplier, String description) {
		RuntimeException lastException = null;
		long delay = initialDelayMs;

		for (int attempt = 0; attempt <= maxRetries; attempt++) {
			try {
				return supplier.get();
			}
			catch (ClarityApiException e) {
				if (e.isClientError()) {
					throw e;
				}
				lastException = e;
			}
			catch (RuntimeException e) {
				lastException = e;
			}

			if (attempt < maxRetries) {
				logger.warn("{} failed (attempt {}/{}): {}. Retrying in {}ms...", description, attempt + 1,
						maxRetries + 1, lastException.getMessage(), delay);
				sleep(delay);
				delay *= 2;
			}
		}

		logger.error("{} failed after {} attempts", description, maxRetries + 1);
		throw lastException;
	}

	private void sleep(long ms) {
		try {
			Thread.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ClarityApiException("Retry interrupted", e);
		}
	}

	@FunctionalInterface
	private interface RequestSupplier<T> {

		T get();

	}

	/**
	 * Builder for {@link RetryingClarityClient}.
	 *
	 * <p>
	 * Defaults: 3 retries, 1 second initial delay.
	 */
	public static class Builder {

		private ClarityClient delegate;

		private int maxRetries = 3;

		private long initialDelayMs = 1000;

		private Builder() {
		}

		/**
		 * Set the client to wrap with retry logic.
		 * @param client the ClarityClient to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(ClarityClient client) {
			this.delegate = client;
			return this;
		}

		/**
		 * Set the maximum number of retry attempts.
		 * @param maxRetries maximum retries (default: 3)
		 * @return this builder
		 */
		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Set the initial delay between retries.
		 * @param delay initial delay (doubles on each retry, default: 1 second)
		 * @return this builder
		 */
		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		/**
		 * Set the initial delay between retries in milliseconds.
		 * @param delayMs initial delay in milliseconds (default: 1000)
		 * @return this builder
		 */
		public Builder initialDelayMs(long delayMs) {
			this.initialDelayMs = delayMs;
			return this;
		}

		/**
		 * Build the RetryingClarityClient.
		 * @return configured client
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingClarityClient build() {
			if (delegate == null) {
				throw new IllegalStateException("A ClarityClient to wrap is required. Call wrapping() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (initialDelayMs <= 0) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			return new RetryingClarityClient(this);
		}

	}

}
