package org.javai.mathtex.emit;

/**
 * Auto-sizing commands chosen for a delimiter pair.
 *
 * @param left opening command such as {@code \left(} or {@code \left.}, empty when unsized
 * @param right closing command such as {@code \right)} or {@code \right.}, empty when unsized
 */
public record ResolvedDelimiters(String left, String right) {

	public static final ResolvedDelimiters UNSIZED = new ResolvedDelimiters("", "");

	public boolean sized() {
		return !left.isEmpty();
	}
}
