package org.javai.mathtex.convert;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import org.javai.mathtex.diag.DiagnosticKind;
import org.javai.mathtex.diag.FormulaDiagnostic;

/**
 * Outcome of converting one formula. The fragment is never empty and never wrapped in math delimiters.
 *
 * @param index position of the formula in document order
 * @param requiredPackages LaTeX packages the fragment needs
 */
public record FormulaResult(
		int index,
		String fragment,
		boolean display,
		List<FormulaDiagnostic> diagnostics,
		SortedSet<String> requiredPackages
) {

	public FormulaResult {
		diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
		requiredPackages = requiredPackages != null
				? Collections.unmodifiableSortedSet(new TreeSet<>(requiredPackages))
				: Collections.unmodifiableSortedSet(new TreeSet<>());
	}

	/**
	 * True when any part of the formula did not convert cleanly.
	 */
	public boolean degraded() {
		return !diagnostics.isEmpty();
	}

	public boolean has(DiagnosticKind kind) {
		return diagnostics.stream().anyMatch(d -> d.kind() == kind);
	}

	/**
	 * The fragment wrapped for placement in text: inline formulas as {@code $...$}, display
	 * formulas in the configured display style.
	 */
	public String wrapped(ConversionOptions options) {
		return display ? options.displayStyle().wrap(fragment) : MathWrapStyle.INLINE.wrap(fragment);
	}
}
