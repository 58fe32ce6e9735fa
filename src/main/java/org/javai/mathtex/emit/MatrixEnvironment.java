package org.javai.mathtex.emit;

/**
 * amsmath matrix environments.
 */
public enum MatrixEnvironment {
	MATRIX("matrix"),
	PMATRIX("pmatrix"),
	BMATRIX("bmatrix"),
	BRACE_MATRIX("Bmatrix"),
	VMATRIX("vmatrix"),
	NORM_MATRIX("Vmatrix");

	private final String environmentName;

	MatrixEnvironment(String environmentName) {
		this.environmentName = environmentName;
	}

	public String begin() {
		return "\\begin{" + environmentName + "}";
	}

	public String end() {
		return "\\end{" + environmentName + "}";
	}
}
