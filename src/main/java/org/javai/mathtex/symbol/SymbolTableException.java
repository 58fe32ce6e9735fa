package org.javai.mathtex.symbol;

/**
 * Exception thrown when a symbol table resource cannot be read or is malformed.
 */
public class SymbolTableException extends RuntimeException {

	public SymbolTableException(String message) {
		super(message);
	}

	public SymbolTableException(String message, Throwable cause) {
		super(message, cause);
	}
}
