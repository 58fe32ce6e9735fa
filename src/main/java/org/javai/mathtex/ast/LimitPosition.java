package org.javai.mathtex.ast;

public enum LimitPosition {
	LOWER,
	UPPER
}
