package org.javai.mathtex.emit;

/**
 * Formatting mode of the formula being emitted, taken from the formula's block-level intent.
 */
public enum EmitMode {
	/** Formula set on its own line; big operators place limits above and below. */
	DISPLAY,
	/** Formula set within a line of text; limits go beside big operators. */
	INLINE;

	public static EmitMode of(boolean display) {
		return display ? DISPLAY : INLINE;
	}
}
