package org.javai.mathtex.symbol;

import java.util.Arrays;
import java.util.Optional;

/**
 * Classification of a symbol, used for spacing and wrapping decisions.
 */
public enum SymbolClass {
	ORDINARY("ordinary"),
	OPERATOR("operator"),
	RELATION("relation"),
	DELIMITER("delimiter"),
	FUNCTION_NAME("function_name");

	private final String key;

	SymbolClass(String key) {
		this.key = key;
	}

	/**
	 * Section name of this class in the symbol table resource.
	 */
	public String key() {
		return key;
	}

	public static Optional<SymbolClass> fromKey(String key) {
		return Arrays.stream(values())
				.filter(c -> c.key.equals(key))
				.findFirst();
	}
}
