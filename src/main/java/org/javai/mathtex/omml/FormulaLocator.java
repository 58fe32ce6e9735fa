package org.javai.mathtex.omml;

import static org.javai.mathtex.omml.OmmlNamespaces.isMath;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * Finds the formulas in a document body.
 *
 * Every {@code m:oMath} is one formula, in document order. A formula inside an
 * {@code m:oMathPara} is display math; one embedded in a paragraph's runs is inline.
 * Formulas nested inside another formula are part of it and are not returned separately.
 */
public final class FormulaLocator {

	private FormulaLocator() {
		// Utility class - no instantiation
	}

	public static List<FormulaInput> locate(Element root) {
		List<FormulaInput> formulas = new ArrayList<>();
		Deque<Visit> pending = new ArrayDeque<>();
		pending.push(new Visit(root, false));
		while (!pending.isEmpty()) {
			Visit visit = pending.pop();
			Element element = visit.element();
			if (isMath(element, "oMath")) {
				formulas.add(new FormulaInput(element, visit.insidePara()));
				continue;
			}
			boolean para = visit.insidePara() || isMath(element, "oMathPara");
			for (Node child = element.getLastChild(); child != null; child = child.getPreviousSibling()) {
				if (child instanceof Element childElement) {
					pending.push(new Visit(childElement, para));
				}
			}
		}
		return formulas;
	}

	private record Visit(Element element, boolean insidePara) {
	}
}
