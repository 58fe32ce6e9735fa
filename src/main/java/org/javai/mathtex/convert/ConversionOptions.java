package org.javai.mathtex.convert;

import org.javai.mathtex.omml.FormulaTreeParser;

/**
 * Options for a conversion run.
 *
 * @param maxDepth nesting depth past which a subtree is flattened to text
 * @param parallelism number of worker threads for a batch; 1 converts on the calling thread
 * @param displayStyle how {@link FormulaResult#wrapped(ConversionOptions)} wraps display formulas
 * @param normalizeWhitespace collapse whitespace runs and trim each fragment
 */
public record ConversionOptions(
		int maxDepth,
		int parallelism,
		MathWrapStyle displayStyle,
		boolean normalizeWhitespace
) {

	public ConversionOptions {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
		}
		if (parallelism < 1) {
			throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
		}
		if (displayStyle == null) {
			displayStyle = MathWrapStyle.DISPLAY;
		}
		if (displayStyle == MathWrapStyle.INLINE) {
			throw new IllegalArgumentException("displayStyle must be display or equation");
		}
	}

	public static ConversionOptions defaults() {
		return new ConversionOptions(FormulaTreeParser.DEFAULT_MAX_DEPTH, 1, MathWrapStyle.DISPLAY, true);
	}

	public ConversionOptions withParallelism(int parallelism) {
		return new ConversionOptions(maxDepth, parallelism, displayStyle, normalizeWhitespace);
	}

	public ConversionOptions withMaxDepth(int maxDepth) {
		return new ConversionOptions(maxDepth, parallelism, displayStyle, normalizeWhitespace);
	}
}
