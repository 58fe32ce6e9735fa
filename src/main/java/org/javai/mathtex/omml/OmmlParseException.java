package org.javai.mathtex.omml;

/**
 * Exception thrown when OMML input cannot be read as XML at all.
 *
 * Structural problems inside a well-formed formula never raise this; they degrade instead.
 */
public class OmmlParseException extends RuntimeException {

	public OmmlParseException(String message) {
		super(message);
	}

	public OmmlParseException(String message, Throwable cause) {
		super(message, cause);
	}
}
