package org.seqfile.publisher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link LimsService} backed by the Clarity REST API.
 *
 * <p>
 * Responses are read with an {@link XmlMapper} into node trees and converted to typed
 * records here, so nothing beyond this class sees raw XML. An exception document returned
 * with a successful status is raised as a {@link ClarityApiException}.
 *
 * <p>
 * Uploading a file takes three calls: a storage location is requested from
 * {@code glsstorage}, the returned record is posted to {@code files} to create the file
 * record, and the content is posted to {@code <file uri>/upload}.
 */
public class ClarityLimsService implements LimsService {

	private static final Logger logger = LoggerFactory.getLogger(ClarityLimsService.class);

	static final String FILE_NAMESPACE = "http://genologics.com/ri/file";

	private final ClarityClient client;

	private final XmlMapper xmlMapper;

	public ClarityLimsService(ClarityClient client) {
		this(client, new XmlMapper());
	}

	public ClarityLimsService(ClarityClient client, XmlMapper xmlMapper) {
		this.client = client;
		this.xmlMapper = xmlMapper;
	}

	@Override
	public StepDetails getStepDetails(String stepUri) {
		JsonNode root = read(client.get(stepUri + "/details"), "step details");

		List<IoMapping> mappings = new ArrayList<>();
		for (JsonNode map : XmlNodeUtils.getArray(root, "input-output-maps", "input-output-map")) {
			JsonNode input = XmlNodeUtils.getNode(map, "input");
			JsonNode output = XmlNodeUtils.getNode(map, "output");
			mappings.add(new IoMapping(text(input, "limsid"), text(input, "uri"), text(output, "limsid"),
					text(output, "uri"), text(output, "output-type"), text(output, "output-generation-type")));
		}

		logger.debug("Step {} has {} input-output maps", stepUri, mappings.size());
		return new StepDetails(stepUri, mappings);
	}

	@Override
	public ArtifactRecord getArtifact(String artifactUri) {
		JsonNode root = read(client.get(artifactUri), "artifact");

		List<Reference> files = new ArrayList<>();
		for (JsonNode file : XmlNodeUtils.getArray(root, "file")) {
			reference(file).ifPresent(files::add);
		}

		return new ArtifactRecord(text(root, "limsid"), text(root, "uri"), text(root, "name"),
				reference(XmlNodeUtils.getNode(root, "sample")).orElse(null), files);
	}

	@Override
	public SampleRecord getSample(String sampleUri) {
		JsonNode root = read(client.get(sampleUri), "sample");
		return new SampleRecord(text(root, "limsid"), text(root, "uri"), text(root, "name"),
				reference(XmlNodeUtils.getNode(root, "project")).orElse(null));
	}

	@Override
	public ProjectRecord getProject(String projectUri) {
		JsonNode root = read(client.get(projectUri), "project");
		return new ProjectRecord(text(root, "limsid"), text(root, "uri"), text(root, "name"),
				reference(XmlNodeUtils.getNode(root, "researcher")).orElse(null));
	}

	@Override
	public ResearcherRecord getResearcher(String researcherUri) {
		JsonNode root = read(client.get(researcherUri), "researcher");
		return new ResearcherRecord(text(root, "uri"), text(root, "first-name"), text(root, "last-name"),
				text(root, "email"));
	}

	@Override
	public FileRecord getFile(String fileUri) {
		return toFileRecord(read(client.get(fileUri), "file"));
	}

	@Override
	public List<Reference> findFilesForArtifact(String artifactId) {
		String query = "files?fileartifactlimsid=" + URLEncoder.encode(artifactId, StandardCharsets.UTF_8);
		JsonNode root = read(client.get(query), "file list");

		List<Reference> files = new ArrayList<>();
		for (JsonNode file : XmlNodeUtils.getArray(root, "file")) {
			reference(file).ifPresent(files::add);
		}
		logger.debug("Artifact {} has {} attached files", artifactId, files.size());
		return files;
	}

	@Override
	public byte[] downloadFile(String fileUri) {
		byte[] content = client.getBytes(fileUri + "/download");
		logger.debug("Downloaded {} ({} bytes)", fileUri, content.length);
		return content;
	}

	@Override
	public FileRecord uploadFile(String attachToUri, String filename, byte[] content, String contentType) {
		String storageResponse = client.post("glsstorage", storageRequest(attachToUri, filename));
		JsonNode storage = read(storageResponse, "storage location");
		String contentLocation = RecordParseException.requireText(text(storage, "content-location"),
				"content-location", "Storage location for " + filename);
		logger.debug("Storage location for {}: {}", filename, contentLocation);

		FileRecord file = toFileRecord(read(client.post("files", storageResponse), "file"));
		logger.debug("Created file record {} for {}", file.id(), filename);

		client.upload(file.uri() + "/upload", filename, content, contentType);
		logger.info("Uploaded {} ({} bytes) as {}", filename, content.length, file.id());
		return file;
	}

	@Override
	public FileRecord publishFile(String fileUri) {
		String current = client.get(fileUri);
		read(current, "file");
		String updated = FileRecordEditor.markPublished(current);
		return toFileRecord(read(client.put(fileUri, updated), "file"));
	}

	static String storageRequest(String attachToUri, String filename) {
		return "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>" + "<file:file xmlns:file=\""
				+ FILE_NAMESPACE + "\">" + "<attached-to>" + XmlNodeUtils.escapeXml(attachToUri)
				+ "</attached-to>" + "<original-location>" + XmlNodeUtils.escapeXml(filename)
				+ "</original-location>" + "</file:file>";
	}

	private FileRecord toFileRecord(JsonNode root) {
		return new FileRecord(text(root, "limsid"), text(root, "uri"), text(root, "attached-to"),
				text(root, "original-location"), text(root, "content-location"),
				"true".equalsIgnoreCase(text(root, "is-published")));
	}

	private JsonNode read(String xml, String what) {
		JsonNode root;
		try {
			root = xmlMapper.readTree(xml);
		}
		catch (JsonProcessingException e) {
			throw new RecordParseException("Unreadable " + what + " record: " + e.getOriginalMessage(), e);
		}

		// exception documents have a message but, unlike every record, no uri
		Optional<String> message = XmlNodeUtils.getText(root, "message");
		if (message.isPresent() && XmlNodeUtils.getText(root, "uri").isEmpty()) {
			throw new ClarityApiException("LIMS returned an exception for " + what + ": " + message.get(), -1, xml);
		}
		return root;
	}

	private static Optional<Reference> reference(JsonNode node) {
		return XmlNodeUtils.getText(node, "uri").map(uri -> new Reference(uri, text(node, "limsid")));
	}

	private static @Nullable String text(JsonNode node, String field) {
		return XmlNodeUtils.getText(node, field).orElse(null);
	}

}
