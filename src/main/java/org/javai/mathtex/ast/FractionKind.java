package org.javai.mathtex.ast;

/**
 * How a fraction is laid out.
 */
public enum FractionKind {
	/** Stacked with a rule between numerator and denominator. */
	BAR,
	/** Inline slash form. */
	LINEAR,
	/** Diagonal slash form. */
	SKEWED,
	/** Stacked without a rule. */
	NO_BAR
}
