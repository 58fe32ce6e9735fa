package org.javai.mathtex.ast;

public enum EnclosureKind {
	BOXED,
	PHANTOM
}
