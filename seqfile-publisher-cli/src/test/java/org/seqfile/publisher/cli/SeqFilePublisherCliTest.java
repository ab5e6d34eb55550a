package org.seqfile.publisher.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.seqfile.publisher.ClarityApiException;
import org.seqfile.publisher.ParsedConfiguration;
import org.seqfile.publisher.PipelineRequest;
import org.seqfile.publisher.PipelineResult;
import org.seqfile.publisher.ProcessingResult;
import org.seqfile.publisher.PublisherProperties;
import org.seqfile.publisher.SequenceFilePipeline;
import org.seqfile.publisher.StepRetrievalException;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for the CLI entry point. The pipeline is mocked; nothing here talks to a LIMS.
 */
@DisplayName("SeqFilePublisherCli Tests")
@ExtendWith(MockitoExtension.class)
class SeqFilePublisherCliTest {

	private static final String STEP_URI = "https://lims.example.org/api/v2/steps/24-1";

	@Mock
	private SequenceFilePipeline pipeline;

	private ParsedConfiguration config;

	@BeforeEach
	void setUp() {
		config = new ParsedConfiguration(new PublisherProperties());
		config.stepUri = STEP_URI;
		config.baseUri = "https://lims.example.org";
		config.password = "pw";
	}

	private static PipelineResult result(int units, int files) {
		return new PipelineResult(STEP_URI, List.of(), List.of(),
				new ProcessingResult(units, files > 0 ? 1 : 0, files, List.of(), List.of()));
	}

	@Nested
	@DisplayName("Argument handling")
	class ArgumentsTest {

		@Test
		@DisplayName("Should print help and exit with 0")
		void shouldPrintHelp() throws Exception {
			assertThat(SeqFilePublisherCli.run(new String[] { "--help" })).isZero();
		}

		@Test
		@DisplayName("Should reject unknown options before doing any work")
		void shouldRejectUnknownOption() {
			assertThatThrownBy(() -> SeqFilePublisherCli.run(new String[] { "-s", STEP_URI, "--force" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("--force");
		}

	}

	@Nested
	@DisplayName("Exit codes")
	class ExitCodeTest {

		@Test
		@DisplayName("Should exit with 0 when files were attached")
		void shouldSucceedWithFiles() throws Exception {
			when(pipeline.run(any(PipelineRequest.class))).thenReturn(result(2, 3));

			assertThat(SeqFilePublisherCli.execute(config, pipeline)).isZero();
			verify(pipeline).run(new PipelineRequest(STEP_URI, null, false));
		}

		@Test
		@DisplayName("Should exit with 0 when there was nothing to do")
		void shouldSucceedWithNothingToDo() throws Exception {
			when(pipeline.run(any(PipelineRequest.class))).thenReturn(result(0, 0));

			assertThat(SeqFilePublisherCli.execute(config, pipeline)).isZero();
		}

		@Test
		@DisplayName("Should exit with 1 when units were processed but nothing attached")
		void shouldFailWithoutFiles() throws Exception {
			when(pipeline.run(any(PipelineRequest.class))).thenReturn(result(2, 0));

			assertThat(SeqFilePublisherCli.execute(config, pipeline)).isEqualTo(1);
		}

		@Test
		@DisplayName("Should exit with 1 when the step cannot be read")
		void shouldFailOnStepRetrieval() throws Exception {
			when(pipeline.run(any(PipelineRequest.class))).thenThrow(new StepRetrievalException(STEP_URI,
					"Could not read step", new ClarityApiException("Unauthorized", 401, "")));

			assertThat(SeqFilePublisherCli.execute(config, pipeline)).isEqualTo(1);
		}

	}

	@Test
	@DisplayName("Should write the run report when requested")
	void shouldWriteReport(@TempDir Path tempDir) throws Exception {
		Path report = tempDir.resolve("report.json");
		config.reportFile = report.toString();
		config.dryRun = true;
		when(pipeline.run(any(PipelineRequest.class))).thenReturn(result(1, 1));

		int exitCode = SeqFilePublisherCli.execute(config, pipeline);

		assertThat(exitCode).isZero();
		assertThat(report).exists().content().contains("\"dry_run\" : true");
	}

}
