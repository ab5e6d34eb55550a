package org.seqfile.publisher;

import java.util.List;

/**
 * Typed access to the LIMS records the pipeline reads and writes.
 *
 * <p>
 * Implementations throw {@link ClarityApiException} when a call fails and
 * {@link RecordParseException} when a response cannot be turned into a record.
 */
public interface LimsService {

	StepDetails getStepDetails(String stepUri);

	ArtifactRecord getArtifact(String artifactUri);

	SampleRecord getSample(String sampleUri);

	ProjectRecord getProject(String projectUri);

	FileRecord getFile(String fileUri);

	ResearcherRecord getResearcher(String researcherUri);

	/**
	 * Files attached to the artifact with the given LIMS id.
	 * @param artifactId artifact LIMS id
	 * @return references to the attached files
	 */
	List<Reference> findFilesForArtifact(String artifactId);

	/**
	 * Download the content of a stored file.
	 * @param fileUri file URI
	 * @return file content
	 */
	byte[] downloadFile(String fileUri);

	/**
	 * Store content as a new file attached to a record.
	 * @param attachToUri URI of the record to attach to, e.g. a project
	 * @param filename original file name
	 * @param content file content
	 * @param contentType content type of the upload
	 * @return the created file record
	 */
	FileRecord uploadFile(String attachToUri, String filename, byte[] content, String contentType);

	/**
	 * Mark a file as published, leaving every other field of its record unchanged.
	 * @param fileUri file URI
	 * @return the file record as returned by the LIMS after the update
	 */
	FileRecord publishFile(String fileUri);

}
