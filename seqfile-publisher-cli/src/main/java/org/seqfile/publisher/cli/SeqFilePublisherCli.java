package org.seqfile.publisher.cli;

import org.seqfile.publisher.ArgumentParser;
import org.seqfile.publisher.ObjectMapperFactory;
import org.seqfile.publisher.ParsedConfiguration;
import org.seqfile.publisher.PipelineResult;
import org.seqfile.publisher.ProcessingResult;
import org.seqfile.publisher.PublisherProperties;
import org.seqfile.publisher.RunReportWriter;
import org.seqfile.publisher.SeqFilePublisherBuilder;
import org.seqfile.publisher.SequenceFilePipeline;
import org.seqfile.publisher.StepRetrievalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;

/**
 * Sequencing File Publisher CLI
 *
 * Distributes the sequencing archive of one LIMS step: files are grouped by sample,
 * bundled per project, uploaded to each project and published to the portal.
 *
 * Usage: java -jar seqfile-publisher-cli.jar -s STEP_URI [OPTIONS]
 *
 * Environment Variables: APIUSER_PW - API password, used when -p is not given
 *
 * Exit status: 0 when at least one file was attached or there was nothing to do, 1
 * otherwise.
 */
public class SeqFilePublisherCli {

	private static final Logger logger = LoggerFactory.getLogger(SeqFilePublisherCli.class);

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Publishing failed: {}", e.getMessage());
			logger.debug("Failure details", e);
			System.exit(1);
		}
	}

	public static int run(String[] args) throws Exception {
		PublisherProperties properties = new PublisherProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		LoggingConfigurator.configure(config.verbose, config.logFile);

		argumentParser.validateEnvironment(config);
		logConfiguration(config);

		properties.setResolverParallelism(config.parallelism);
		SequenceFilePipeline pipeline = SeqFilePublisherBuilder.create()
			.baseUri(config.baseUri)
			.username(config.username)
			.password(config.password)
			.properties(properties)
			.buildPipeline();

		return execute(config, pipeline);
	}

	/**
	 * Run the pipeline for a parsed configuration and translate the outcome into an exit
	 * code.
	 */
	static int execute(ParsedConfiguration config, SequenceFilePipeline pipeline) throws IOException {
		PipelineResult result;
		try {
			result = pipeline.run(config.toRequest());
		}
		catch (StepRetrievalException e) {
			logger.error("Cannot process step: {}", e.getMessage());
			return 1;
		}

		if (config.reportFile != null) {
			new RunReportWriter(ObjectMapperFactory.create()).write(result, config.dryRun,
					Paths.get(config.reportFile));
		}

		return exitCode(result.result());
	}

	static int exitCode(ProcessingResult result) {
		return result.success() ? 0 : 1;
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Step: {}", config.stepUri);
		logger.info("  LIMS: {}", config.baseUri);
		logger.info("  User: {}", config.username);
		if (config.zipArtifactId != null) {
			logger.info("  Archive artifact: {}", config.zipArtifactId);
		}
		logger.info("  Parallelism: {}", config.parallelism);
		logger.info("  Email notifications: {}",
				config.sendEmails ? "ENABLED" : "DISABLED (use --send-emails to enable)");
		if (config.dryRun) {
			logger.info("  Mode: DRY RUN (nothing will be uploaded)");
		}
		logger.debug("Parsed configuration: {}", config);
	}

}
