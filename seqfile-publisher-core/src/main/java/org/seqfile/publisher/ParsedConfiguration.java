package org.seqfile.publisher;

import org.jspecify.annotations.Nullable;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// LIMS connection
	public @Nullable String stepUri;

	public String username;

	public @Nullable String password;

	public @Nullable String baseUri;

	// Archive selection
	public @Nullable String zipArtifactId;

	// Mode flags
	public boolean dryRun = false;

	public boolean verbose = false;

	public boolean sendEmails = false;

	public boolean helpRequested = false;

	// Execution
	public int parallelism;

	// Output
	public @Nullable String logFile;

	public @Nullable String reportFile;

	public ParsedConfiguration(PublisherProperties defaultProperties) {
		this.username = defaultProperties.getDefaultUsername();
		this.baseUri = defaultProperties.getBaseUri();
		this.parallelism = defaultProperties.getResolverParallelism();
	}

	public PipelineRequest toRequest() {
		return new PipelineRequest(stepUri, zipArtifactId, dryRun, sendEmails);
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "stepUri='" + stepUri + '\'' + ", username='" + username + '\''
				+ ", password=" + (password != null ? "'****'" : "null") + ", baseUri='" + baseUri + '\''
				+ ", zipArtifactId='" + zipArtifactId + '\'' + ", dryRun=" + dryRun + ", verbose=" + verbose
				+ ", sendEmails=" + sendEmails + ", helpRequested=" + helpRequested + ", parallelism=" + parallelism
				+ ", logFile='" + logFile + '\'' + ", reportFile='" + reportFile + '\'' + '}';
	}

}
