package org.javai.mathtex.diag;

/**
 * Why a formula, or part of one, did not convert cleanly.
 */
public enum DiagnosticKind {
	/** A structural element was missing a required part. */
	MALFORMED_SHAPE,
	/** An element the parser has no handler for. */
	UNRECOGNIZED_ELEMENT,
	UNRECOGNIZED_ACCENT,
	UNRECOGNIZED_DELIMITER,
	/** Nesting exceeded the configured depth cap; the rest of the subtree was flattened. */
	DEPTH_EXCEEDED,
	EMPTY_FORMULA,
	/** An unexpected failure caught at the formula boundary. */
	INTERNAL_FAILURE
}
