package org.javai.mathtex.ast;

import java.util.Optional;
import java.util.Set;

/**
 * Fixed enumeration of accents and over/under decorations, keyed by the glyphs
 * that identify them in the source.
 */
public enum AccentKind {
	HAT("\u0302", "^", "ˆ"),
	TILDE("\u0303", "~", "˜"),
	BAR("\u0304", "¯"),
	DOT("\u0307", "˙"),
	DDOT("\u0308", "¨"),
	VEC("\u20D7", "→"),
	LEFT_VEC("\u20D6", "←"),
	BREVE("\u0306", "˘"),
	CHECK("\u030C", "ˇ"),
	RING("\u030A", "˚"),
	GRAVE("\u0300", "`"),
	ACUTE("\u0301", "´"),
	OVERLINE("\u0305", "‾"),
	UNDERLINE("\u0332", "_"),
	OVERBRACE("⏞"),
	UNDERBRACE("⏟"),
	UNKNOWN();

	private final Set<String> glyphs;
	private final String primary;

	AccentKind(String... glyphs) {
		this.glyphs = Set.of(glyphs);
		this.primary = glyphs.length > 0 ? glyphs[0] : "";
	}

	/**
	 * The canonical glyph for this kind, empty for {@link #UNKNOWN}.
	 */
	public String glyph() {
		return primary;
	}

	public static Optional<AccentKind> fromGlyph(String glyph) {
		if (glyph == null || glyph.isEmpty()) {
			return Optional.empty();
		}
		for (AccentKind kind : values()) {
			if (kind.glyphs.contains(glyph)) {
				return Optional.of(kind);
			}
		}
		return Optional.empty();
	}
}
