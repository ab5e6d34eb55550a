package org.seqfile.publisher;

import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the sequencing file publisher. Plain Java with no
 * framework dependencies for easy testing.
 */
public class ArgumentParser {

	private final PublisherProperties defaultProperties;

	public ArgumentParser(PublisherProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-s", "--step-uri":
					config.stepUri = getRequiredValue(args, i, "step-uri");
					i++;
					break;

				case "-u", "--username":
					config.username = getRequiredValue(args, i, "username");
					i++;
					break;

				case "-p", "--password":
					config.password = getRequiredValue(args, i, "password");
					i++;
					break;

				case "-b", "--base-uri":
					config.baseUri = getRequiredValue(args, i, "base-uri");
					i++;
					break;

				case "-l", "--log-file":
					config.logFile = getRequiredValue(args, i, "log-file");
					i++;
					break;

				case "-z", "--zip-artifact":
					config.zipArtifactId = getRequiredValue(args, i, "zip-artifact");
					i++;
					break;

				case "-d", "--dry-run":
					config.dryRun = true;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "--send-emails":
					config.sendEmails = true;
					break;

				case "--parallelism":
					String parallelismStr = getRequiredValue(args, i, "parallelism");
					try {
						config.parallelism = Integer.parseInt(parallelismStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid parallelism '" + parallelismStr + "': must be a positive integer");
					}
					i++;
					break;

				case "--report":
					config.reportFile = getRequiredValue(args, i, "report");
					i++;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		if (config.baseUri == null && config.stepUri != null) {
			config.baseUri = deriveBaseUri(config.stepUri);
		}

		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: seqfile-publisher -s STEP_URI [OPTIONS]\n");
		help.append("\n");
		help.append("Groups the sequencing files of a step's archive by project, creates one zip per project\n");
		help.append("and uploads it to the project with portal publishing enabled.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help                Show this help message\n");
		help.append("    -s, --step-uri URI        URI of the step to process (required)\n");
		help.append("    -u, --username USER       API user name (default: ")
			.append(defaultProperties.getDefaultUsername())
			.append(")\n");
		help.append("    -p, --password PASSWORD   API password (default: ")
			.append(SeqFilePublisherBuilder.PASSWORD_VARIABLE)
			.append(" from .env or environment)\n");
		help.append("    -b, --base-uri URI        LIMS server base URI (default: derived from the step URI)\n");
		help.append("    -z, --zip-artifact LIMSID Use the archive attached to this artifact instead of\n");
		help.append("                              searching the step's shared result files\n");
		help.append("    -d, --dry-run             Build bundles but do not upload anything\n");
		help.append("    -v, --verbose             Enable debug logging\n");
		help.append("    --send-emails             Email each project's researcher after publishing\n");
		help.append("                              (default: disabled)\n");
		help.append("    -l, --log-file FILE       Also write a detailed log to FILE\n");
		help.append("    --parallelism N           Units resolved concurrently (default: ")
			.append(defaultProperties.getResolverParallelism())
			.append(")\n");
		help.append("    --report FILE             Write a JSON run report to FILE\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    ")
			.append(SeqFilePublisherBuilder.PASSWORD_VARIABLE)
			.append("                API password, used when -p is not given\n");
		help.append("\n");
		help.append("EXIT STATUS:\n");
		help.append("    0  at least one file was attached, or there was nothing to do\n");
		help.append("    1  nothing was attached although the step had work, or a fatal error occurred\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    seqfile-publisher -s https://lims.example.org/api/v2/steps/24-1234\n");
		help.append("    seqfile-publisher -s https://lims.example.org/api/v2/steps/24-1234 --dry-run --verbose\n");
		help.append("    seqfile-publisher -s https://lims.example.org/api/v2/steps/24-1234 -z 92-5678 -l run.log\n");
		help.append("\n");

		return help.toString();
	}

	/**
	 * Fill in the password from {@code APIUSER_PW} when it was not given on the command
	 * line.
	 * @param config parsed configuration
	 * @throws IllegalStateException if no password is available
	 */
	public void validateEnvironment(ParsedConfiguration config) {
		if (config.password == null || config.password.isBlank()) {
			config.password = EnvironmentSupport.get(SeqFilePublisherBuilder.PASSWORD_VARIABLE);
		}
		if (config.password == null || config.password.isBlank()) {
			throw new IllegalStateException("API password is required. Pass -p or set "
					+ SeqFilePublisherBuilder.PASSWORD_VARIABLE + " in the environment or a .env file.");
		}
	}

	/**
	 * Derive the server base URI (scheme, host and port) from a step URI.
	 * @param stepUri step URI
	 * @return base URI, or null if the step URI is not an absolute URI
	 */
	static @Nullable String deriveBaseUri(String stepUri) {
		try {
			URI uri = new URI(stepUri);
			if (uri.getScheme() == null || uri.getRawAuthority() == null) {
				return null;
			}
			return uri.getScheme() + "://" + uri.getRawAuthority();
		}
		catch (URISyntaxException e) {
			return null;
		}
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		if (config.helpRequested) {
			return;
		}

		List<String> errors = new ArrayList<>();

		if (config.stepUri == null || config.stepUri.isBlank()) {
			errors.add("Step URI is required (-s)");
		}
		else if (!config.stepUri.matches("^https?://.+/steps/[^/]+/?$")) {
			errors.add("Step URI must look like https://host/api/v2/steps/<step id> (got: " + config.stepUri + ")");
		}

		if (config.baseUri == null || !config.baseUri.matches("^https?://.+")) {
			errors.add("Base URI must be an http(s) URI (got: " + config.baseUri + ")");
		}

		if (config.username == null || config.username.isBlank()) {
			errors.add("Username cannot be empty");
		}

		if (config.parallelism <= 0) {
			errors.add("Parallelism must be positive (got: " + config.parallelism + ")");
		}
		else if (config.parallelism > 64) {
			errors.add("Parallelism too large (got: " + config.parallelism + ", max: 64)");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
