package org.seqfile.publisher;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for sequencing file publishing.
 *
 * <p>
 * Properties can be set directly via setters or passed to
 * {@link SeqFilePublisherBuilder}. Command-line arguments take precedence over these
 * values.
 *
 * <p>
 * Default values suit a standard Clarity installation.
 */
public class PublisherProperties {

	/**
	 * API user name used when none is given.
	 */
	private String defaultUsername = "apiuser";

	/**
	 * Server base URI, e.g. {@code https://lims.example.org}. Derived from the step URI
	 * when not set.
	 */
	private @Nullable String baseUri;

	/**
	 * Extension that identifies sequencing archives among a step's attached files.
	 */
	private String archiveExtension = ArchiveLocator.DEFAULT_EXTENSION;

	/**
	 * Suffix appended to the project name to form the bundle file name.
	 */
	private String bundleSuffix = BundleBuilder.DEFAULT_SUFFIX;

	/**
	 * Path fragments that mark OS metadata entries to skip when reading archives.
	 */
	private List<String> metadataMarkers = new ArrayList<>(ArchiveDecomposer.DEFAULT_METADATA_MARKERS);

	/**
	 * Number of units whose owner is resolved concurrently.
	 */
	private int resolverParallelism = 4;

	/**
	 * Maximum number of retry attempts for failed idempotent API requests.
	 */
	private int maxRetries = 3;

	/**
	 * Initial delay in milliseconds between retry attempts; doubles on each retry.
	 */
	private long retryDelayMs = 1000;

	/**
	 * HTTP connect timeout in seconds.
	 */
	private int connectTimeoutSeconds = 30;

	/**
	 * SMTP server used for researcher notifications.
	 */
	private String smtpHost = "localhost";

	private int smtpPort = 25;

	/**
	 * Sender address of researcher notifications.
	 */
	private String mailFrom = "noreply.clarity@localhost";

	/**
	 * Subject of researcher notifications; the project name is appended.
	 */
	private String mailSubjectPrefix = "Sequencing Files Available - ";

	public String getDefaultUsername() {
		return defaultUsername;
	}

	public void setDefaultUsername(String defaultUsername) {
		this.defaultUsername = defaultUsername;
	}

	public @Nullable String getBaseUri() {
		return baseUri;
	}

	public void setBaseUri(@Nullable String baseUri) {
		this.baseUri = baseUri;
	}

	public String getArchiveExtension() {
		return archiveExtension;
	}

	public void setArchiveExtension(String archiveExtension) {
		this.archiveExtension = archiveExtension;
	}

	public String getBundleSuffix() {
		return bundleSuffix;
	}

	public void setBundleSuffix(String bundleSuffix) {
		this.bundleSuffix = bundleSuffix;
	}

	public List<String> getMetadataMarkers() {
		return metadataMarkers;
	}

	public void setMetadataMarkers(List<String> metadataMarkers) {
		this.metadataMarkers = metadataMarkers;
	}

	public int getResolverParallelism() {
		return resolverParallelism;
	}

	public void setResolverParallelism(int resolverParallelism) {
		this.resolverParallelism = resolverParallelism;
	}

	public int getMaxRetries() {
		return maxRetries;
	}

	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public long getRetryDelayMs() {
		return retryDelayMs;
	}

	public void setRetryDelayMs(long retryDelayMs) {
		this.retryDelayMs = retryDelayMs;
	}

	public int getConnectTimeoutSeconds() {
		return connectTimeoutSeconds;
	}

	public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
		this.connectTimeoutSeconds = connectTimeoutSeconds;
	}

	public String getSmtpHost() {
		return smtpHost;
	}

	public void setSmtpHost(String smtpHost) {
		this.smtpHost = smtpHost;
	}

	public int getSmtpPort() {
		return smtpPort;
	}

	public void setSmtpPort(int smtpPort) {
		this.smtpPort = smtpPort;
	}

	public String getMailFrom() {
		return mailFrom;
	}

	public void setMailFrom(String mailFrom) {
		this.mailFrom = mailFrom;
	}

	public String getMailSubjectPrefix() {
		return mailSubjectPrefix;
	}

	public void setMailSubjectPrefix(String mailSubjectPrefix) {
		this.mailSubjectPrefix = mailSubjectPrefix;
	}

}
