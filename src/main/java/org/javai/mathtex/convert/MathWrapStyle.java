package org.javai.mathtex.convert;

/**
 * How a caller wraps a formula body into surrounding document text.
 */
public enum MathWrapStyle {
	/** {@code \[ ... \]} */
	DISPLAY("display"),
	/** Numbered {@code equation} environment. */
	EQUATION("equation"),
	/** {@code $ ... $} */
	INLINE("inline");

	private final String key;

	MathWrapStyle(String key) {
		this.key = key;
	}

	public String key() {
		return key;
	}

	public String wrap(String fragment) {
		return switch (this) {
			case DISPLAY -> "\\[" + fragment + "\\]";
			case EQUATION -> "\\begin{equation}\n" + fragment + "\n\\end{equation}";
			case INLINE -> "$" + fragment + "$";
		};
	}

	/**
	 * @throws IllegalArgumentException if the key names no style
	 */
	public static MathWrapStyle fromKey(String key) {
		for (MathWrapStyle style : values()) {
			if (style.key.equalsIgnoreCase(key)) {
				return style;
			}
		}
		throw new IllegalArgumentException("Unknown math wrap style: " + key);
	}
}
