package org.javai.mathtex.emit;

/**
 * Accumulates LaTeX tokens, inserting a space only where a control word would otherwise
 * run into a following letter ({@code \times P}, never {@code \timesP}).
 */
public final class LatexBuilder {

	private final StringBuilder sb = new StringBuilder();

	public LatexBuilder append(String token) {
		if (token == null || token.isEmpty()) {
			return this;
		}
		if (endsWithControlWord(sb) && Character.isLetter(token.codePointAt(0))) {
			sb.append(' ');
		}
		sb.append(token);
		return this;
	}

	public boolean isEmpty() {
		return sb.length() == 0;
	}

	@Override
	public String toString() {
		return sb.toString();
	}

	/**
	 * True when the text ends in {@code \name} with nothing after the letters.
	 */
	static boolean endsWithControlWord(CharSequence text) {
		int i = text.length();
		while (i > 0 && isAsciiLetter(text.charAt(i - 1))) {
			i--;
		}
		if (i == text.length() || i == 0 || text.charAt(i - 1) != '\\') {
			return false;
		}
		// "\\" is a line break, so letters after it start ordinary text
		return i < 2 || text.charAt(i - 2) != '\\';
	}

	private static boolean isAsciiLetter(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}
}
