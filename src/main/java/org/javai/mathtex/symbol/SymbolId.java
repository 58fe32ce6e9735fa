package org.javai.mathtex.symbol;

import java.util.Objects;

/**
 * Identity of a symbol in the {@link SymbolTable}: either a Unicode code point or a named glyph
 * such as a function name.
 */
public sealed interface SymbolId {

	static SymbolId codePoint(int codePoint) {
		return new CodePoint(codePoint);
	}

	static SymbolId named(String name) {
		return new Named(name);
	}

	record CodePoint(int value) implements SymbolId {

		public CodePoint {
			if (!Character.isValidCodePoint(value)) {
				throw new IllegalArgumentException("Invalid code point: " + value);
			}
		}

		@Override
		public String toString() {
			return String.format("U+%04X", value);
		}
	}

	record Named(String name) implements SymbolId {

		public Named {
			Objects.requireNonNull(name, "name must not be null");
			if (name.isBlank()) {
				throw new IllegalArgumentException("Symbol name must not be blank");
			}
		}

		@Override
		public String toString() {
			return name;
		}
	}
}
