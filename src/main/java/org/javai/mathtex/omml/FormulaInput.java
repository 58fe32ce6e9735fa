package org.javai.mathtex.omml;

import java.util.Objects;
import org.w3c.dom.Element;

/**
 * One formula occurrence handed to the pipeline.
 *
 * @param formula the {@code m:oMath} (or {@code m:oMathPara}) element
 * @param display true for a formula set on its own line
 */
public record FormulaInput(Element formula, boolean display) {

	public FormulaInput {
		Objects.requireNonNull(formula, "formula must not be null");
	}

	public static FormulaInput inline(Element formula) {
		return new FormulaInput(formula, false);
	}

	public static FormulaInput display(Element formula) {
		return new FormulaInput(formula, true);
	}
}
