package org.javai.mathtex.emit;

/**
 * Escaping of LaTeX reserved characters.
 *
 * Escaping happens exactly once, when literal text becomes a token; assembled fragments
 * are never escaped again.
 */
public final class LatexEscaper {

	private LatexEscaper() {
		// Utility class - no instantiation
	}

	/**
	 * Math-mode replacement for a reserved character.
	 *
	 * @return the replacement, or {@code null} when the character needs no escaping
	 */
	public static String escapeMath(int codePoint) {
		return switch (codePoint) {
			case '\\' -> "\\backslash";
			case '{' -> "\\{";
			case '}' -> "\\}";
			case '#' -> "\\#";
			case '$' -> "\\$";
			case '%' -> "\\%";
			case '&' -> "\\&";
			case '_' -> "\\_";
			case '^' -> "\\hat{}";
			case '~' -> "\\sim";
			default -> null;
		};
	}

	public static String escapeMath(String text) {
		StringBuilder sb = new StringBuilder();
		text.codePoints().forEach(cp -> {
			String escaped = escapeMath(cp);
			if (escaped != null) {
				sb.append(escaped);
			} else {
				sb.appendCodePoint(cp);
			}
		});
		return sb.toString();
	}

	/**
	 * Escape prose placed inside {@code \text{...}}.
	 */
	public static String escapeText(String text) {
		StringBuilder sb = new StringBuilder();
		text.codePoints().forEach(cp -> {
			switch (cp) {
				case '\\' -> sb.append("\\textbackslash{}");
				case '^' -> sb.append("\\textasciicircum{}");
				case '~' -> sb.append("\\textasciitilde{}");
				case '{', '}', '#', '$', '%', '&', '_' -> sb.append('\\').appendCodePoint(cp);
				default -> sb.appendCodePoint(cp);
			}
		});
		return sb.toString();
	}
}
