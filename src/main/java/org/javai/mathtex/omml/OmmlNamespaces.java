package org.javai.mathtex.omml;

import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * Namespaces of Office Math Markup Language and the word-processing body that hosts it,
 * plus the element/attribute accessors the parser shares.
 */
public final class OmmlNamespaces {

	public static final String MATH = "http://schemas.openxmlformats.org/officeDocument/2006/math";
	public static final String WORD = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";

	private OmmlNamespaces() {
		// Utility class - no instantiation
	}

	/**
	 * Local name of a node, tolerating DOMs built without namespace awareness.
	 */
	public static String localName(Node node) {
		String local = node.getLocalName();
		if (local != null) {
			return local;
		}
		String name = node.getNodeName();
		int colon = name.indexOf(':');
		return colon >= 0 ? name.substring(colon + 1) : name;
	}

	public static boolean isMath(Node node) {
		return inNamespace(node, MATH, "m:");
	}

	public static boolean isWord(Node node) {
		return inNamespace(node, WORD, "w:");
	}

	public static boolean isMath(Node node, String localName) {
		return node.getNodeType() == Node.ELEMENT_NODE && isMath(node) && localName.equals(localName(node));
	}

	/**
	 * Read the {@code m:val} attribute of an element.
	 *
	 * @return the value, or {@code null} when the attribute is absent
	 */
	public static String val(Element element) {
		if (element.hasAttributeNS(MATH, "val")) {
			return element.getAttributeNS(MATH, "val");
		}
		if (element.hasAttribute("m:val")) {
			return element.getAttribute("m:val");
		}
		if (element.hasAttribute("val")) {
			return element.getAttribute("val");
		}
		return null;
	}

	private static boolean inNamespace(Node node, String uri, String prefix) {
		String ns = node.getNamespaceURI();
		if (ns != null) {
			return uri.equals(ns);
		}
		return node.getNodeName().startsWith(prefix);
	}
}
