package org.seqfile.publisher;

import org.jspecify.annotations.Nullable;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;

/**
 * Edits a file record document in place so that it can be PUT back unchanged except for
 * the edited field. Works on the DOM rather than a data-bound tree so unknown elements,
 * attributes and namespace prefixes survive.
 */
public final class FileRecordEditor {

	static final String PUBLISHED_ELEMENT = "is-published";

	private FileRecordEditor() {
	}

	/**
	 * Set {@code is-published} to {@code true}, adding the element if it is absent.
	 * @param fileXml file record as returned by the LIMS
	 * @return the edited document
	 * @throws RecordParseException if the document cannot be parsed or written
	 */
	public static String markPublished(String fileXml) {
		Document document = parse(fileXml);
		Element root = document.getDocumentElement();

		Element published = findChild(root, PUBLISHED_ELEMENT);
		if (published == null) {
			published = document.createElementNS(null, PUBLISHED_ELEMENT);
			root.appendChild(published);
		}
		published.setTextContent("true");

		return write(document);
	}

	private static @Nullable Element findChild(Element parent, String localName) {
		NodeList children = parent.getChildNodes();
		for (int i = 0; i < children.getLength(); i++) {
			Node child = children.item(i);
			if (child.getNodeType() == Node.ELEMENT_NODE && localName.equals(child.getLocalName())) {
				return (Element) child;
			}
		}
		return null;
	}

	private static Document parse(String xml) {
		try {
			DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
			factory.setNamespaceAware(true);
			factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
			factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
			factory.setExpandEntityReferences(false);
			DocumentBuilder builder = factory.newDocumentBuilder();
			return builder.parse(new InputSource(new StringReader(xml)));
		}
		catch (ParserConfigurationException | SAXException | IOException e) {
			throw new RecordParseException("Failed to parse file record: " + e.getMessage(), e);
		}
	}

	private static String write(Document document) {
		try {
			TransformerFactory factory = TransformerFactory.newInstance();
			factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
			Transformer transformer = factory.newTransformer();
			transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
			transformer.setOutputProperty(OutputKeys.STANDALONE, "yes");
			StringWriter writer = new StringWriter();
			transformer.transform(new DOMSource(document), new StreamResult(writer));
			return writer.toString();
		}
		catch (TransformerException e) {
			throw new RecordParseException("Failed to write file record: " + e.getMessage(), e);
		}
	}

}
