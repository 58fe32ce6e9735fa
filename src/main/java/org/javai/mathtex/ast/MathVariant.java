package org.javai.mathtex.ast;

/**
 * Typeface intent declared by the source for a run.
 */
public enum MathVariant {
	/** No explicit intent: single letters italic, recognized names upright. */
	DEFAULT,
	ROMAN,
	BOLD,
	ITALIC,
	BOLD_ITALIC,
	SCRIPT,
	FRAKTUR,
	DOUBLE_STRUCK,
	SANS_SERIF,
	MONOSPACE,
	/** Ordinary prose text embedded in a formula. */
	NORMAL_TEXT
}
