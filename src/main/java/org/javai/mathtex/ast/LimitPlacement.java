package org.javai.mathtex.ast;

/**
 * Where the source asked the limits of an n-ary operator to go.
 */
public enum LimitPlacement {
	/** No explicit request; the markup's natural placement for the mode applies. */
	DEFAULT,
	UNDER_OVER,
	SUB_SUP
}
