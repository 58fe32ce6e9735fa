package org.javai.mathtex.symbol;

import java.util.Objects;
import java.util.Set;

/**
 * Target markup token for a symbol and its classification.
 *
 * @param token the LaTeX token emitted for the symbol
 * @param symbolClass spacing/wrapping class
 * @param largeOperator true for big operators that take limits, such as sums and integrals
 * @param packages LaTeX packages the token needs, empty for plain LaTeX
 */
public record SymbolEntry(String token, SymbolClass symbolClass, boolean largeOperator, Set<String> packages) {

	public SymbolEntry {
		Objects.requireNonNull(token, "token must not be null");
		Objects.requireNonNull(symbolClass, "symbolClass must not be null");
		packages = packages == null ? Set.of() : Set.copyOf(packages);
	}

	public SymbolEntry(String token, SymbolClass symbolClass) {
		this(token, symbolClass, false, Set.of());
	}

	public SymbolEntry(String token, SymbolClass symbolClass, boolean largeOperator) {
		this(token, symbolClass, largeOperator, Set.of());
	}

	/**
	 * Whether the token is a single control word ({@code \alpha}, {@code \sum}) as opposed to
	 * literal text or a composite such as {@code ^{\circ}}.
	 */
	public boolean controlWord() {
		if (token.length() < 2 || token.charAt(0) != '\\') {
			return false;
		}
		for (int i = 1; i < token.length(); i++) {
			if (!Character.isLetter(token.charAt(i))) {
				return false;
			}
		}
		return true;
	}
}
