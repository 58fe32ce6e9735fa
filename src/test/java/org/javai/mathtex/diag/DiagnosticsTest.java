package org.javai.mathtex.diag;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class DiagnosticsTest {

	@Test
	void recordsEntriesAgainstTheFormulaIndex() {
		Diagnostics diagnostics = new Diagnostics(7);

		diagnostics.report(DiagnosticKind.UNRECOGNIZED_ELEMENT, "Unrecognized element <m:foo>");

		assertThat(diagnostics.isEmpty()).isFalse();
		assertThat(diagnostics.has(DiagnosticKind.UNRECOGNIZED_ELEMENT)).isTrue();
		assertThat(diagnostics.has(DiagnosticKind.DEPTH_EXCEEDED)).isFalse();
		assertThat(diagnostics.entries()).singleElement()
				.satisfies(d -> assertThat(d.toString()).isEqualTo("formula 7: UNRECOGNIZED_ELEMENT - Unrecognized element <m:foo>"));
	}

	@Test
	void detachedCollectorHasNoIndex() {
		assertThat(Diagnostics.detached().formulaIndex()).isEqualTo(-1);
		assertThat(Diagnostics.detached().isEmpty()).isTrue();
	}
}
