package org.javai.mathtex.omml;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

class FormulaLocatorTest {

	private static final String BODY = "<w:body xmlns:w=\"" + OmmlNamespaces.WORD + "\" xmlns:m=\"" + OmmlNamespaces.MATH + "\">"
			+ "<w:p><w:r><w:t>Let </w:t></w:r><m:oMath><m:r><m:t>x</m:t></m:r></m:oMath></w:p>"
			+ "<w:p><m:oMathPara><m:oMath><m:r><m:t>y</m:t></m:r></m:oMath>"
			+ "<m:oMath><m:r><m:t>z</m:t></m:r></m:oMath></m:oMathPara></w:p>"
			+ "<w:p><m:oMath><m:r><m:t>w</m:t></m:r></m:oMath></w:p>"
			+ "</w:body>";

	@Test
	void findsFormulasInDocumentOrderWithDisplayIntent() {
		Element body = new OmmlReader().read(BODY);

		List<FormulaInput> formulas = FormulaLocator.locate(body);

		assertThat(formulas).extracting(f -> FormulaTreeParser.textOf(f.formula()))
				.containsExactly("x", "y", "z", "w");
		assertThat(formulas).extracting(FormulaInput::display)
				.containsExactly(false, true, true, false);
	}

	@Test
	void documentWithoutMathHasNoFormulas() {
		Element body = new OmmlReader().read("<w:body xmlns:w=\"" + OmmlNamespaces.WORD + "\"><w:p/></w:body>");

		assertThat(FormulaLocator.locate(body)).isEmpty();
	}

	@Test
	void findsFormulaBelowVeryDeepMarkup() {
		int levels = 50_000;
		StringBuilder xml = new StringBuilder("<w:body xmlns:w=\"" + OmmlNamespaces.WORD + "\" xmlns:m=\""
				+ OmmlNamespaces.MATH + "\">");
		for (int i = 0; i < levels; i++) {
			xml.append("<w:sdt>");
		}
		xml.append("<m:oMath><m:r><m:t>q</m:t></m:r></m:oMath>");
		for (int i = 0; i < levels; i++) {
			xml.append("</w:sdt>");
		}
		Element body = new OmmlReader().read(xml.append("</w:body>").toString());

		assertThat(FormulaLocator.locate(body)).singleElement()
				.satisfies(f -> assertThat(FormulaTreeParser.textOf(f.formula())).isEqualTo("q"));
	}
}
