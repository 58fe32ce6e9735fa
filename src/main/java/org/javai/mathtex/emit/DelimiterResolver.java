package org.javai.mathtex.emit;

import java.util.Map;
import org.javai.mathtex.ast.Bracket;
import org.javai.mathtex.ast.DelimiterMarker;
import org.javai.mathtex.symbol.SymbolClass;
import org.javai.mathtex.symbol.SymbolEntry;
import org.javai.mathtex.symbol.SymbolTable;

/**
 * Chooses the LaTeX delimiter commands for a pair of markers.
 *
 * Every visible marker is auto-sized, and an invisible side of a sized pair is written as the
 * null delimiter so that {@code \left} and {@code \right} stay balanced.
 */
public final class DelimiterResolver {

	private static final String NULL_DELIMITER = ".";

	private static final Map<Bracket, MatrixEnvironment> MATRIX_ENVIRONMENTS = Map.of(
			Bracket.PARENTHESIS, MatrixEnvironment.PMATRIX,
			Bracket.SQUARE, MatrixEnvironment.BMATRIX,
			Bracket.CURLY, MatrixEnvironment.BRACE_MATRIX,
			Bracket.VERTICAL_BAR, MatrixEnvironment.VMATRIX,
			Bracket.DOUBLE_VERTICAL_BAR, MatrixEnvironment.NORM_MATRIX
	);

	private final SymbolTable symbols;

	public DelimiterResolver(SymbolTable symbols) {
		this.symbols = symbols;
	}

	/**
	 * Resolve a delimiter pair. Two invisible markers resolve to {@link ResolvedDelimiters#UNSIZED}.
	 */
	public ResolvedDelimiters resolve(DelimiterMarker open, DelimiterMarker close) {
		if (open.invisible() && close.invisible()) {
			return ResolvedDelimiters.UNSIZED;
		}
		return new ResolvedDelimiters(
				"\\left" + glyph(open, true),
				"\\right" + glyph(close, false));
	}

	/**
	 * Resolve the markers that enclosed a matrix. Matching pairs with a dedicated environment
	 * fold into that environment; any other visible pair is kept as sized delimiters around a
	 * plain matrix.
	 */
	public MatrixLayout resolveMatrix(DelimiterMarker open, DelimiterMarker close) {
		if (open.invisible() && close.invisible()) {
			return new MatrixLayout(MatrixEnvironment.MATRIX, ResolvedDelimiters.UNSIZED);
		}
		if (open.bracket() == close.bracket() && !open.mirrored() && !close.mirrored()) {
			MatrixEnvironment environment = MATRIX_ENVIRONMENTS.get(open.bracket());
			if (environment != null) {
				return new MatrixLayout(environment, ResolvedDelimiters.UNSIZED);
			}
		}
		return new MatrixLayout(MatrixEnvironment.MATRIX, resolve(open, close));
	}

	/**
	 * LaTeX glyph for one side of a pair; {@code .} for an invisible marker. Only delimiter-class
	 * table entries are used, anything else is escaped.
	 */
	public String glyph(DelimiterMarker marker, boolean openingSide) {
		if (marker.invisible()) {
			return NULL_DELIMITER;
		}
		Bracket bracket = marker.bracket();
		boolean useOpen = openingSide != marker.mirrored();
		String source = useOpen ? bracket.openGlyph() : bracket.closeGlyph();
		return symbols.lookup(source.codePointAt(0))
				.filter(entry -> entry.symbolClass() == SymbolClass.DELIMITER)
				.map(SymbolEntry::token)
				.orElseGet(() -> LatexEscaper.escapeMath(source));
	}
}
