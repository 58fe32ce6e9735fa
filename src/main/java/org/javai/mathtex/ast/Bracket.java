package org.javai.mathtex.ast;

import java.util.Optional;

/**
 * Bracket families that can enclose a delimited expression.
 */
public enum Bracket {
	PARENTHESIS("(", ")"),
	SQUARE("[", "]"),
	CURLY("{", "}"),
	VERTICAL_BAR("|", "|"),
	DOUBLE_VERTICAL_BAR("‖", "‖"),
	ANGLE("⟨", "⟩"),
	CEILING("⌈", "⌉"),
	FLOOR("⌊", "⌋"),
	NONE("", "");

	private final String openGlyph;
	private final String closeGlyph;

	Bracket(String openGlyph, String closeGlyph) {
		this.openGlyph = openGlyph;
		this.closeGlyph = closeGlyph;
	}

	public String openGlyph() {
		return openGlyph;
	}

	public String closeGlyph() {
		return closeGlyph;
	}

	public boolean symmetric() {
		return openGlyph.equals(closeGlyph);
	}

	/**
	 * Find the family a glyph belongs to, accepting the common look-alikes Word emits.
	 */
	public static Optional<Bracket> fromGlyph(String glyph) {
		if (glyph == null || glyph.isEmpty()) {
			return Optional.of(NONE);
		}
		String normalized = switch (glyph) {
			case "〈", "<" -> ANGLE.openGlyph;
			case "〉", ">" -> ANGLE.closeGlyph;
			case "∥", "ǁ" -> DOUBLE_VERTICAL_BAR.openGlyph;
			case "∣", "│" -> VERTICAL_BAR.openGlyph;
			default -> glyph;
		};
		for (Bracket bracket : values()) {
			if (bracket != NONE && (bracket.openGlyph.equals(normalized) || bracket.closeGlyph.equals(normalized))) {
				return Optional.of(bracket);
			}
		}
		return Optional.empty();
	}
}
