package org.javai.mathtex.diag;

import java.util.Objects;

/**
 * Advisory note about a formula that degraded rather than converted cleanly.
 *
 * @param formulaIndex position of the formula in document order, -1 when converted outside a batch
 * @param kind category of the problem
 * @param reason short human readable explanation
 */
public record FormulaDiagnostic(int formulaIndex, DiagnosticKind kind, String reason) {

	public FormulaDiagnostic {
		Objects.requireNonNull(kind, "kind must not be null");
		reason = reason != null ? reason : "";
	}

	@Override
	public String toString() {
		return "formula " + formulaIndex + ": " + kind + " - " + reason;
	}
}
