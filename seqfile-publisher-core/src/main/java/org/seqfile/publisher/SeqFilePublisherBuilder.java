package org.seqfile.publisher;

import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Builder that wires the publishing pipeline.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Password from APIUSER_PW
 * SequenceFilePipeline pipeline = SeqFilePublisherBuilder.create()
 *     .baseUri("https://lims.example.org")
 *     .username("apiuser")
 *     .passwordFromEnv()
 *     .buildPipeline();
 *
 * PipelineResult result = pipeline.run(PipelineRequest.forStep(stepUri));
 *
 * // For testing with a mock HTTP client
 * ClarityClient mockClient = mock(ClarityClient.class);
 * SequenceFilePipeline testPipeline = SeqFilePublisherBuilder.create()
 *     .clarityClient(mockClient)
 *     .buildPipeline();
 * }
 * </pre>
 */
public class SeqFilePublisherBuilder {

	public static final String PASSWORD_VARIABLE = "APIUSER_PW";

	private @Nullable String baseUri;

	private @Nullable String username;

	private @Nullable String password;

	private PublisherProperties properties;

	private @Nullable XmlMapper xmlMapper;

	private @Nullable ClarityClient clarityClient;

	private @Nullable ArchiveService archiveService;

	private @Nullable LimsService limsService;

	private @Nullable NotificationService notificationService;

	private SeqFilePublisherBuilder() {
		this.properties = new PublisherProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new SeqFilePublisherBuilder
	 */
	public static SeqFilePublisherBuilder create() {
		return new SeqFilePublisherBuilder();
	}

	/**
	 * Set the server base URI. Overrides {@link PublisherProperties#getBaseUri()}.
	 * @param baseUri server base URI, with or without the {@code /api/v2} suffix
	 * @return this builder
	 */
	public SeqFilePublisherBuilder baseUri(@Nullable String baseUri) {
		this.baseUri = baseUri;
		return this;
	}

	/**
	 * Set the API user name. Defaults to {@link PublisherProperties#getDefaultUsername()}.
	 * @param username API user name
	 * @return this builder
	 */
	public SeqFilePublisherBuilder username(@Nullable String username) {
		this.username = username;
		return this;
	}

	/**
	 * Set the API password directly.
	 * @param password API password
	 * @return this builder
	 */
	public SeqFilePublisherBuilder password(@Nullable String password) {
		this.password = password;
		return this;
	}

	/**
	 * Read the API password from {@code APIUSER_PW} ({@code .env} file or environment).
	 * @return this builder
	 * @throws IllegalStateException if APIUSER_PW is not set
	 */
	public SeqFilePublisherBuilder passwordFromEnv() {
		this.password = EnvironmentSupport.get(PASSWORD_VARIABLE);
		if (this.password == null || this.password.isBlank()) {
			throw new IllegalStateException(PASSWORD_VARIABLE
					+ " environment variable is required. Set it in the environment or a .env file, or pass -p.");
		}
		return this;
	}

	/**
	 * Set publisher properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public SeqFilePublisherBuilder properties(@Nullable PublisherProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom XmlMapper for reading LIMS responses.
	 * @param xmlMapper Jackson XmlMapper (null to use default)
	 * @return this builder
	 */
	public SeqFilePublisherBuilder xmlMapper(@Nullable XmlMapper xmlMapper) {
		this.xmlMapper = xmlMapper;
		return this;
	}

	/**
	 * Set a custom ClarityClient implementation. Useful for testing with mocks or for
	 * adding decorators.
	 *
	 * <p>
	 * When a custom client is provided, no credentials or base URI are required and no
	 * retry decorator is added.
	 * @param clarityClient custom client (null to use default)
	 * @return this builder
	 */
	public SeqFilePublisherBuilder clarityClient(@Nullable ClarityClient clarityClient) {
		this.clarityClient = clarityClient;
		return this;
	}

	/**
	 * Set a custom ArchiveService implementation.
	 * @param archiveService custom ArchiveService implementation (null to use default)
	 * @return this builder
	 */
	public SeqFilePublisherBuilder archiveService(@Nullable ArchiveService archiveService) {
		this.archiveService = archiveService;
		return this;
	}

	/**
	 * Set a custom LimsService implementation. Takes precedence over
	 * {@link #clarityClient(ClarityClient)} and the connection settings.
	 * @param limsService custom LimsService (null to use the Clarity REST API)
	 * @return this builder
	 */
	public SeqFilePublisherBuilder limsService(@Nullable LimsService limsService) {
		this.limsService = limsService;
		return this;
	}

	/**
	 * Set a custom NotificationService implementation.
	 * @param notificationService custom service (null to mail researchers over SMTP)
	 * @return this builder
	 */
	public SeqFilePublisherBuilder notificationService(@Nullable NotificationService notificationService) {
		this.notificationService = notificationService;
		return this;
	}

	/**
	 * Build the complete pipeline.
	 * @return configured SequenceFilePipeline
	 */
	public SequenceFilePipeline buildPipeline() {
		Components components = buildComponents();
		OwnershipResolver resolver = new OwnershipResolver(components.limsService);
		MatchAggregator aggregator = new MatchAggregator(resolver, new NameMatcher(),
				properties.getResolverParallelism());
		return new SequenceFilePipeline(components.limsService,
				new ArchiveLocator(components.limsService, properties.getArchiveExtension()),
				new ArchiveDecomposer(components.archiveService, properties.getMetadataMarkers()), aggregator,
				new BundleBuilder(components.archiveService, properties.getBundleSuffix()),
				new BundlePublisher(components.limsService), notifications(components.limsService));
	}

	/**
	 * Build the LimsService directly (for advanced usage).
	 * @return configured LimsService
	 */
	public LimsService buildLimsService() {
		return buildComponents().limsService;
	}

	private NotificationService notifications(LimsService lims) {
		return this.notificationService != null ? this.notificationService
				: new MailNotificationService(lims, properties);
	}

	private Components buildComponents() {
		ArchiveService archive = this.archiveService != null ? this.archiveService : new ZipArchiveService();
		if (this.limsService != null) {
			return new Components(this.limsService, archive);
		}
		XmlMapper mapper = this.xmlMapper != null ? this.xmlMapper : new XmlMapper();
		ClarityClient client = this.clarityClient != null ? this.clarityClient : createDefaultClient();
		return new Components(new ClarityLimsService(client, mapper), archive);
	}

	private ClarityClient createDefaultClient() {
		String base = this.baseUri != null ? this.baseUri : properties.getBaseUri();
		if (base == null || base.isBlank()) {
			throw new IllegalStateException("LIMS base URI is required. Call baseUri() or set it in the properties.");
		}
		if (password == null || password.isBlank()) {
			throw new IllegalStateException("API password is required. Call password() or passwordFromEnv() first.");
		}
		String user = this.username != null ? this.username : properties.getDefaultUsername();

		ClarityHttpClient httpClient = new ClarityHttpClient(base, user, password,
				Duration.ofSeconds(properties.getConnectTimeoutSeconds()));
		return RetryingClarityClient.builder()
			.wrapping(httpClient)
			.maxRetries(properties.getMaxRetries())
			.initialDelayMs(properties.getRetryDelayMs())
			.build();
	}

	/**
	 * Internal record to hold built components.
	 */
	private record Components(LimsService limsService, ArchiveService archiveService) {
	}

}
