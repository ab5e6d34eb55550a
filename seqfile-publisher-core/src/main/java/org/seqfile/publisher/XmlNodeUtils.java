package org.seqfile.publisher;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Navigation helpers for XML documents read into {@link JsonNode} trees by
 * {@code XmlMapper}.
 *
 * <p>
 * In such trees attributes and child elements are both object fields, an element with
 * attributes and text keeps its text under the empty key, and a repeated element becomes
 * an array only when it occurs more than once.
 */
public final class XmlNodeUtils {

	private XmlNodeUtils() {
	}

	/**
	 * Text of an element or attribute at the given path.
	 * @param node starting node
	 * @param path element or attribute names; for repeated elements the first is used
	 * @return trimmed text, or empty if the path does not exist or has no text
	 */
	public static Optional<String> getText(JsonNode node, String... path) {
		JsonNode target = getNode(node, path);
		if (target.isObject()) {
			target = target.path("");
		}
		if (target.isMissingNode() || target.isNull() || target.isContainerNode()) {
			return Optional.empty();
		}
		String text = target.asText().trim();
		return text.isEmpty() ? Optional.empty() : Optional.of(text);
	}

	/**
	 * Node at the given path, taking the first element wherever a path step is repeated.
	 * @param node starting node
	 * @param path element names
	 * @return the node, or a missing node if the path does not exist
	 */
	public static JsonNode getNode(JsonNode node, String... path) {
		JsonNode target = node;
		for (String p : path) {
			if (target.isArray()) {
				target = target.path(0);
			}
			target = target.path(p);
		}
		return target.isArray() ? target.path(0) : target;
	}

	/**
	 * All elements at the given path, whether the last step occurs once or repeatedly.
	 * @param node starting node
	 * @param path element names
	 * @return elements in document order, empty if the path does not exist
	 */
	public static List<JsonNode> getArray(JsonNode node, String... path) {
		JsonNode target = node;
		for (int i = 0; i < path.length; i++) {
			if (target.isArray()) {
				target = target.path(0);
			}
			target = target.path(path[i]);
		}

		List<JsonNode> result = new ArrayList<>();
		if (target.isArray()) {
			target.forEach(result::add);
		}
		else if (!target.isMissingNode() && !target.isNull()) {
			result.add(target);
		}
		return result;
	}

	/**
	 * Escapes the five XML special characters, for text and attribute values alike.
	 * @param value raw text
	 * @return text safe to embed in XML or HTML
	 */
	public static String escapeXml(String value) {
		StringBuilder escaped = new StringBuilder(value.length());
		for (char c : value.toCharArray()) {
			switch (c) {
				case '&' -> escaped.append("&amp;");
				case '<' -> escaped.append("&lt;");
				case '>' -> escaped.append("&gt;");
				case '"' -> escaped.append("&quot;");
				case '\'' -> escaped.append("&apos;");
				default -> escaped.append(c);
			}
		}
		return escaped.toString();
	}

}
