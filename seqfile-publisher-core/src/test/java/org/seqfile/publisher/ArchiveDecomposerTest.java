package org.seqfile.publisher;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ArchiveDecomposer Tests")
class ArchiveDecomposerTest {

	private ArchiveDecomposer decomposer;

	@BeforeEach
	void setUp() {
		decomposer = new ArchiveDecomposer(new ZipArchiveService());
	}

	@Nested
	@DisplayName("Grouping")
	class GroupingTest {

		@Test
		@DisplayName("Should group files by base name in first-occurrence order")
		void shouldGroupByBaseName() {
			byte[] zip = TestArchives.zip("S2.ab1", "S1.ab1", "S2.seq", "S1.seq", "S1.pdf");

			Map<String, FileGroup> groups = decomposer.decompose(zip);

			assertThat(groups.keySet()).containsExactly("S2", "S1");
			assertThat(groups.get("S1").members()).extracting(ArchiveMember::filename)
				.containsExactly("S1.ab1", "S1.seq", "S1.pdf");
			assertThat(groups.get("S2").fileCount()).isEqualTo(2);
		}

		@Test
		@DisplayName("Should strip directory prefixes from member names")
		void shouldStripDirectoryPrefix() {
			byte[] zip = TestArchives.zip("plate1/", "plate1/S1.ab1", "plate1\\S1.seq");

			Map<String, FileGroup> groups = decomposer.decompose(zip);

			assertThat(groups).containsOnlyKeys("S1");
			assertThat(groups.get("S1").members()).extracting(ArchiveMember::filename)
				.containsExactly("S1.ab1", "S1.seq");
			assertThat(groups.get("S1").members().get(0).data())
				.isEqualTo("plate1/S1.ab1".getBytes(StandardCharsets.UTF_8));
		}

		@Test
		@DisplayName("Should group ignoring case and keep the first-seen identifier")
		void shouldGroupIgnoringCase() {
			byte[] zip = TestArchives.zip("Sample01.ab1", "SAMPLE01.seq", "sample01.txt");

			Map<String, FileGroup> groups = decomposer.decompose(zip);

			assertThat(groups).containsOnlyKeys("Sample01");
			assertThat(groups.get("Sample01").fileCount()).isEqualTo(3);
		}

		@Test
		@DisplayName("Should keep files without extension as their own group")
		void shouldHandleFilesWithoutExtension() {
			Map<String, FileGroup> groups = decomposer.decompose(TestArchives.zip("README", "S1.ab1"));

			assertThat(groups.keySet()).containsExactly("README", "S1");
			assertThat(groups.get("README").extensions()).isEqualTo("(none)");
		}

		@Test
		@DisplayName("Should only strip the final extension")
		void shouldStripOnlyFinalExtension() {
			Map<String, FileGroup> groups = decomposer.decompose(TestArchives.zip("S1.fastq.gz", "S1.fastq.md5"));

			assertThat(groups).containsOnlyKeys("S1.fastq");
		}

		@Test
		@DisplayName("Should fold a dotted capital I together with its lower-case form")
		void shouldFoldDottedCapitalI() {
			Map<String, FileGroup> groups = decomposer.decompose(TestArchives.zip("İX1.ab1", "i̇x1.seq"));

			assertThat(groups).containsOnlyKeys("İX1");
			assertThat(groups.get("İX1").members()).extracting(ArchiveMember::filename)
				.containsExactly("İX1.ab1", "i̇x1.seq");
		}

		@Test
		@DisplayName("Should produce the same groups in the same order for the same archive")
		void shouldBeDeterministic() {
			byte[] zip = TestArchives.zip("S3.ab1", "S1.ab1", "s3.seq", "S2.ab1", "S1.seq");

			Map<String, FileGroup> first = decomposer.decompose(zip);
			Map<String, FileGroup> second = decomposer.decompose(zip);

			assertThat(second.keySet()).containsExactlyElementsOf(first.keySet()).containsExactly("S3", "S1", "S2");
			first.forEach((identifier, group) -> assertThat(second.get(identifier).members())
				.extracting(ArchiveMember::filename)
				.containsExactlyElementsOf(group.members().stream().map(ArchiveMember::filename).toList()));
		}

		@Test
		@DisplayName("Should return an unmodifiable map")
		void shouldReturnUnmodifiableMap() {
			Map<String, FileGroup> groups = decomposer.decompose(TestArchives.zip("S1.ab1"));

			assertThatThrownBy(() -> groups.put("x", TestArchives.group("x", "x.ab1")))
				.isInstanceOf(UnsupportedOperationException.class);
		}

	}

	@Nested
	@DisplayName("Filtering")
	class FilteringTest {

		@Test
		@DisplayName("Should skip OS metadata entries and directories")
		void shouldSkipMetadataAndDirectories() {
			byte[] zip = TestArchives.zip("run/", "run/S1.ab1", "__MACOSX/run/._S1.ab1", "run/.DS_Store", "S2.seq");

			Map<String, FileGroup> groups = decomposer.decompose(zip);

			assertThat(groups.keySet()).containsExactly("S1", "S2");
			assertThat(groups.get("S1").fileCount()).isEqualTo(1);
		}

		@Test
		@DisplayName("Should honour custom metadata markers")
		void shouldHonourCustomMarkers() {
			ArchiveDecomposer custom = new ArchiveDecomposer(new ZipArchiveService(), List.of("Thumbs.db"));

			Map<String, FileGroup> groups = custom.decompose(TestArchives.zip("Thumbs.db", "S1.ab1"));

			assertThat(groups).containsOnlyKeys("S1");
		}

		@Test
		@DisplayName("Should return no groups for an archive with only metadata")
		void shouldReturnEmptyForMetadataOnly() {
			assertThat(decomposer.decompose(TestArchives.zip("__MACOSX/", "__MACOSX/._x"))).isEmpty();
		}

	}

	@Nested
	@DisplayName("Errors")
	class ErrorTest {

		@Test
		@DisplayName("Should raise ArchiveException for a corrupt archive")
		void shouldRaiseForCorruptArchive() {
			byte[] corrupt = "PK but not really".getBytes(StandardCharsets.UTF_8);

			assertThatThrownBy(() -> decomposer.decompose(corrupt)).isInstanceOf(ArchiveException.class);
		}

	}

	@Nested
	@DisplayName("Merging")
	class MergeTest {

		@Test
		@DisplayName("Should concatenate groups of several archives")
		void shouldConcatenate() {
			Map<String, FileGroup> first = Map.of("S1", TestArchives.group("S1", "S1.ab1"));
			Map<String, FileGroup> second = Map.of("S2", TestArchives.group("S2", "S2.ab1"));

			Map<String, FileGroup> merged = ArchiveDecomposer.merge(List.of(first, second));

			assertThat(merged.keySet()).containsExactly("S1", "S2");
		}

		@Test
		@DisplayName("Should let a later archive replace a group but keep its position")
		void shouldReplaceLaterGroupInPlace() {
			Map<String, FileGroup> first = new LinkedHashMap<>();
			first.put("S1", TestArchives.group("S1", "S1.ab1"));
			first.put("S2", TestArchives.group("S2", "S2.ab1"));
			Map<String, FileGroup> second = Map.of("s1", TestArchives.group("s1", "s1.ab1", "s1.seq"));

			Map<String, FileGroup> merged = ArchiveDecomposer.merge(List.of(first, second));

			assertThat(merged.keySet()).containsExactly("s1", "S2");
			assertThat(merged.get("s1").fileCount()).isEqualTo(2);
		}

		@Test
		@DisplayName("Should return an empty map for no archives")
		void shouldMergeNothing() {
			assertThat(ArchiveDecomposer.merge(List.of())).isEmpty();
		}

	}

}
