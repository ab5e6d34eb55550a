package org.seqfile.publisher;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("BundlePublisher Tests")
@ExtendWith(MockitoExtension.class)
class BundlePublisherTest {

	private static final Owner PROJECT_A = new Owner("Project A", "P1", "https://lims/api/v2/projects/P1");

	private static final Owner PROJECT_B = new Owner("Smith/Jones", "P2", "https://lims/api/v2/projects/P2");

	@Mock
	private LimsService limsService;

	private BundlePublisher publisher;

	@BeforeEach
	void setUp() {
		publisher = new BundlePublisher(limsService);
	}

	private static BundleArchive archive(Owner owner, int fileCount) {
		List<String> names = IntStream.rangeClosed(1, fileCount).mapToObj(i -> "S" + i + ".ab1").toList();
		return new BundleArchive(owner, owner.name() + "_sequencing_files.zip", new byte[] { 'P', 'K' }, names,
				List.of());
	}

	private static FileRecord file(String id, boolean published) {
		return new FileRecord(id, "https://lims/api/v2/files/" + id, null, "x.zip", null, published);
	}

	@Nested
	@DisplayName("Publishing")
	class PublishingTest {

		@Test
		@DisplayName("Should upload and publish each bundle to its owner")
		void shouldUploadAndPublish() {
			when(limsService.uploadFile(eq(PROJECT_A.uri()), eq("Project A_sequencing_files.zip"), any(),
					eq("application/zip")))
				.thenReturn(file("40-1", false));
			when(limsService.publishFile("https://lims/api/v2/files/40-1")).thenReturn(file("40-1", true));

			PublishReport report = publisher.publish(List.of(archive(PROJECT_A, 3)), false);

			assertThat(report.published()).hasSize(1);
			PublishedBundle bundle = report.published().get(0);
			assertThat(bundle.fileId()).isEqualTo("40-1");
			assertThat(bundle.published()).isTrue();
			assertThat(report.result().filesAttached()).isEqualTo(3);
			assertThat(report.result().errors()).isEmpty();
		}

		@Test
		@DisplayName("Should sanitize the archive file name")
		void shouldSanitizeFilename() {
			when(limsService.uploadFile(eq(PROJECT_B.uri()), eq("Smith_Jones_sequencing_files.zip"), any(), any()))
				.thenReturn(file("40-2", false));
			when(limsService.publishFile(anyString())).thenReturn(file("40-2", true));

			PublishReport report = publisher.publish(List.of(archive(PROJECT_B, 1)), false);

			assertThat(report.published().get(0).filename()).isEqualTo("Smith_Jones_sequencing_files.zip");
		}

	}

	@Nested
	@DisplayName("Failures")
	class FailureTest {

		@Test
		@DisplayName("Should record a failed upload and continue with the next bundle")
		void shouldContinueAfterFailedUpload() {
			when(limsService.uploadFile(eq(PROJECT_A.uri()), anyString(), any(), anyString()))
				.thenThrow(new ClarityApiException("LIMS API error 500", 500, ""));
			when(limsService.uploadFile(eq(PROJECT_B.uri()), anyString(), any(), anyString()))
				.thenReturn(file("40-2", false));
			when(limsService.publishFile(anyString())).thenReturn(file("40-2", true));

			PublishReport report = publisher.publish(List.of(archive(PROJECT_A, 2), archive(PROJECT_B, 1)), false);

			assertThat(report.published()).extracting(PublishedBundle::owner).containsExactly(PROJECT_B);
			assertThat(report.result().filesAttached()).isEqualTo(1);
			assertThat(report.result().errors()).singleElement()
				.asString()
				.startsWith("Upload failed for Project A_sequencing_files.zip (project P1)");
		}

		@Test
		@DisplayName("Should not count a bundle the LIMS did not confirm as published")
		void shouldFailUnconfirmedPublish() {
			when(limsService.uploadFile(anyString(), anyString(), any(), anyString())).thenReturn(file("40-1", false));
			when(limsService.publishFile(anyString())).thenReturn(file("40-1", false));

			PublishReport report = publisher.publish(List.of(archive(PROJECT_A, 2)), false);

			assertThat(report.published()).isEmpty();
			assertThat(report.result().filesAttached()).isZero();
			assertThat(report.result().errors()).singleElement().asString().contains("did not confirm");
		}

		@Test
		@DisplayName("Should record a failed publish after a successful upload")
		void shouldRecordFailedPublish() {
			when(limsService.uploadFile(anyString(), anyString(), any(), anyString())).thenReturn(file("40-1", false));
			when(limsService.publishFile(anyString())).thenThrow(new ClarityApiException("Forbidden", 403, ""));

			PublishReport report = publisher.publish(List.of(archive(PROJECT_A, 2)), false);

			assertThat(report.result().errors()).singleElement().asString().contains("uploaded as 40-1 but not published");
		}

	}

	@Test
	@DisplayName("Should not call the LIMS in a dry run")
	void shouldNotUploadInDryRun() {
		PublishReport report = publisher.publish(List.of(archive(PROJECT_A, 2)), true);

		assertThat(report.published()).isEmpty();
		assertThat(report.result().filesAttached()).isZero();
		verifyNoInteractions(limsService);
	}

}
