package org.javai.mathtex.ast;

import java.util.Optional;

/**
 * One side of a delimiter pair.
 *
 * @param bracket the bracket family, {@link Bracket#NONE} for an invisible marker
 * @param mirrored true when the glyph faces the other way, e.g. {@code ]} used as an opener
 */
public record DelimiterMarker(Bracket bracket, boolean mirrored) {

	public static final DelimiterMarker NONE = new DelimiterMarker(Bracket.NONE, false);

	public DelimiterMarker {
		bracket = bracket != null ? bracket : Bracket.NONE;
		mirrored = mirrored && !bracket.symmetric();
	}

	public static DelimiterMarker of(Bracket bracket) {
		return new DelimiterMarker(bracket, false);
	}

	public boolean invisible() {
		return bracket == Bracket.NONE;
	}

	/**
	 * Resolve a source glyph found on the given side of a delimiter.
	 *
	 * @return empty when the glyph is not a known bracket
	 */
	public static Optional<DelimiterMarker> fromGlyph(String glyph, boolean openingSide) {
		return Bracket.fromGlyph(glyph).map(bracket -> {
			if (bracket == Bracket.NONE) {
				return NONE;
			}
			String expected = openingSide ? bracket.openGlyph() : bracket.closeGlyph();
			return new DelimiterMarker(bracket, !expected.equals(glyph) && !bracket.symmetric()
					&& (openingSide ? bracket.closeGlyph() : bracket.openGlyph()).equals(glyph));
		});
	}
}
