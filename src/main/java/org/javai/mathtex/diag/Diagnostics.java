package org.javai.mathtex.diag;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the diagnostics raised while converting one formula.
 *
 * Instances are confined to the thread converting their formula and are never shared.
 */
public final class Diagnostics {

	private final int formulaIndex;
	private final List<FormulaDiagnostic> entries = new ArrayList<>();

	public Diagnostics(int formulaIndex) {
		this.formulaIndex = formulaIndex;
	}

	/**
	 * A collector for a formula converted outside of a document batch.
	 */
	public static Diagnostics detached() {
		return new Diagnostics(-1);
	}

	public void report(DiagnosticKind kind, String reason) {
		entries.add(new FormulaDiagnostic(formulaIndex, kind, reason));
	}

	public int formulaIndex() {
		return formulaIndex;
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	public boolean has(DiagnosticKind kind) {
		return entries.stream().anyMatch(d -> d.kind() == kind);
	}

	public List<FormulaDiagnostic> entries() {
		return List.copyOf(entries);
	}
}
