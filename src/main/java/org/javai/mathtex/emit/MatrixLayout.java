package org.javai.mathtex.emit;

/**
 * How a matrix is rendered: its environment plus any sized delimiters around it.
 */
public record MatrixLayout(MatrixEnvironment environment, ResolvedDelimiters outer) {
}
