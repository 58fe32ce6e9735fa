package org.javai.mathtex.omml;

import java.io.InputStream;
import java.io.StringReader;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Reads OMML or word-processing XML into a namespace-aware DOM.
 *
 * DOCTYPE declarations are refused so that crafted documents cannot pull in external entities.
 */
public final class OmmlReader {

	private final DocumentBuilderFactory factory;

	public OmmlReader() {
		this.factory = DocumentBuilderFactory.newInstance();
		factory.setNamespaceAware(true);
		factory.setExpandEntityReferences(false);
		factory.setXIncludeAware(false);
		try {
			factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
			factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
		} catch (ParserConfigurationException e) {
			throw new IllegalStateException("XML parser does not support secure processing", e);
		}
	}

	/**
	 * Parse an XML string and return its document element. The string is already decoded, so an
	 * {@code encoding} in its XML declaration is ignored.
	 *
	 * @throws OmmlParseException if the text is not well-formed XML
	 */
	public Element read(String xml) {
		if (xml == null || xml.isBlank()) {
			throw new OmmlParseException("OMML input is empty");
		}
		return read(new InputSource(new StringReader(xml)));
	}

	/**
	 * Parse an XML stream and return its document element.
	 *
	 * @throws OmmlParseException if the stream is not well-formed XML
	 */
	public Element read(InputStream inputStream) {
		return read(new InputSource(inputStream));
	}

	private Element read(InputSource source) {
		try {
			DocumentBuilder builder = newBuilder();
			Document document = builder.parse(source);
			return document.getDocumentElement();
		} catch (OmmlParseException e) {
			throw e;
		} catch (Exception e) {
			throw new OmmlParseException("Failed to read OMML: " + e.getMessage(), e);
		}
	}

	// DocumentBuilder is not thread safe; the factory is only read after construction.
	private synchronized DocumentBuilder newBuilder() throws ParserConfigurationException {
		DocumentBuilder builder = factory.newDocumentBuilder();
		builder.setErrorHandler(new DefaultHandler());
		return builder;
	}
}
