package org.seqfile.publisher;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ZipArchiveService}.
 */
@DisplayName("ZipArchiveService Tests")
class ZipArchiveServiceTest {

	private ZipArchiveService archiveService;

	@BeforeEach
	void setUp() {
		archiveService = new ZipArchiveService();
	}

	@Nested
	@DisplayName("Reading")
	class ReadingTest {

		@Test
		@DisplayName("Should read entries in archive order with their content")
		void shouldReadEntriesInOrder() {
			byte[] zip = TestArchives.zip("run1/", "run1/S1.ab1", "run1/S1.seq", "S2.ab1");

			List<ArchiveMember> entries = archiveService.readEntries(zip);

			assertThat(entries).extracting(ArchiveMember::filename)
				.containsExactly("run1/", "run1/S1.ab1", "run1/S1.seq", "S2.ab1");
			assertThat(entries.get(0).isDirectory()).isTrue();
			assertThat(entries.get(0).data()).isEmpty();
			assertThat(new String(entries.get(1).data(), StandardCharsets.UTF_8)).isEqualTo("run1/S1.ab1");
		}

		@Test
		@DisplayName("Should read an empty archive")
		void shouldReadEmptyArchive() {
			assertThat(archiveService.readEntries(TestArchives.zip())).isEmpty();
		}

		@Test
		@DisplayName("Should decode names without the UTF-8 flag as CP437")
		void shouldDecodeLegacyNames() {
			byte[] zip = TestArchives.zip(Charset.forName("IBM437"), "Müller_S1.ab1", "Ångström.seq");

			List<ArchiveMember> entries = archiveService.readEntries(zip);

			assertThat(entries).extracting(ArchiveMember::filename).containsExactly("Müller_S1.ab1", "Ångström.seq");
		}

		@Test
		@DisplayName("Should reject bytes that are not a ZIP archive")
		void shouldRejectNonZipBytes() {
			byte[] garbage = "definitely not a zip".getBytes(StandardCharsets.UTF_8);

			assertThatThrownBy(() -> archiveService.readEntries(garbage)).isInstanceOf(ArchiveException.class)
				.hasMessageContaining("Not a ZIP archive");
		}

		@Test
		@DisplayName("Should reject an empty byte array")
		void shouldRejectEmptyBytes() {
			assertThatThrownBy(() -> archiveService.readEntries(new byte[0])).isInstanceOf(ArchiveException.class);
		}

	}

	@Nested
	@DisplayName("Writing")
	class WritingTest {

		@Test
		@DisplayName("Should write members that read back unchanged")
		void shouldWriteReadableArchive() {
			List<ArchiveMember> members = List.of(TestArchives.member("S1.ab1"), TestArchives.member("S1.seq"));

			byte[] zip = archiveService.createArchive(members);
			List<ArchiveMember> readBack = archiveService.readEntries(zip);

			assertThat(readBack).extracting(ArchiveMember::filename).containsExactly("S1.ab1", "S1.seq");
			assertThat(readBack.get(1).data()).isEqualTo("S1.seq".getBytes(StandardCharsets.UTF_8));
		}

		@Test
		@DisplayName("Should write every member when names repeat")
		void shouldWriteDuplicateNames() {
			List<ArchiveMember> members = List.of(new ArchiveMember("S1.ab1", new byte[] { 1 }),
					new ArchiveMember("S1.ab1", new byte[] { 2 }));

			List<ArchiveMember> readBack = archiveService.readEntries(archiveService.createArchive(members));

			assertThat(readBack).extracting(ArchiveMember::filename).containsExactly("S1.ab1", "S1.ab1");
			assertThat(readBack.get(0).data()).containsExactly(1);
			assertThat(readBack.get(1).data()).containsExactly(2);
		}

		@Test
		@DisplayName("Should keep non-ASCII names")
		void shouldKeepUnicodeNames() {
			List<ArchiveMember> members = List.of(TestArchives.member("Müller_S1.ab1"));

			List<ArchiveMember> readBack = archiveService.readEntries(archiveService.createArchive(members));

			assertThat(readBack).extracting(ArchiveMember::filename).containsExactly("Müller_S1.ab1");
		}

	}

}
