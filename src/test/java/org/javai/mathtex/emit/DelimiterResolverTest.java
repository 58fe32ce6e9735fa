package org.javai.mathtex.emit;

import static org.assertj.core.api.Assertions.assertThat;

import org.javai.mathtex.ast.Bracket;
import org.javai.mathtex.ast.DelimiterMarker;
import org.javai.mathtex.symbol.SymbolTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DelimiterResolverTest {

	private final DelimiterResolver resolver = new DelimiterResolver(SymbolTable.standard());

	@Test
	void twoInvisibleMarkersAreUnsized() {
		ResolvedDelimiters resolved = resolver.resolve(DelimiterMarker.NONE, DelimiterMarker.NONE);

		assertThat(resolved).isEqualTo(ResolvedDelimiters.UNSIZED);
		assertThat(resolved.sized()).isFalse();
	}

	@Test
	void invisibleSideBecomesNullDelimiter() {
		ResolvedDelimiters resolved = resolver.resolve(DelimiterMarker.NONE, DelimiterMarker.of(Bracket.PARENTHESIS));

		assertThat(resolved.left()).isEqualTo("\\left.");
		assertThat(resolved.right()).isEqualTo("\\right)");
	}

	@ParameterizedTest
	@CsvSource({
			"PARENTHESIS, \\left(, \\right)",
			"SQUARE, \\left[, \\right]",
			"CURLY, \\left\\{, \\right\\}",
			"VERTICAL_BAR, \\left|, \\right|",
			"DOUBLE_VERTICAL_BAR, \\left\\|, \\right\\|",
			"ANGLE, \\left\\langle, \\right\\rangle",
			"CEILING, \\left\\lceil, \\right\\rceil",
			"FLOOR, \\left\\lfloor, \\right\\rfloor"
	})
	void bracketFamiliesMapToSizedCommands(Bracket bracket, String left, String right) {
		ResolvedDelimiters resolved = resolver.resolve(DelimiterMarker.of(bracket), DelimiterMarker.of(bracket));

		assertThat(resolved.left()).isEqualTo(left);
		assertThat(resolved.right()).isEqualTo(right);
	}

	@Test
	void mirroredMarkerUsesTheOppositeGlyph() {
		DelimiterMarker reversed = new DelimiterMarker(Bracket.SQUARE, true);

		ResolvedDelimiters resolved = resolver.resolve(reversed, reversed);

		assertThat(resolved.left()).isEqualTo("\\left]");
		assertThat(resolved.right()).isEqualTo("\\right[");
	}

	@ParameterizedTest
	@CsvSource({
			"PARENTHESIS, PMATRIX",
			"SQUARE, BMATRIX",
			"CURLY, BRACE_MATRIX",
			"VERTICAL_BAR, VMATRIX",
			"DOUBLE_VERTICAL_BAR, NORM_MATRIX"
	})
	void matchingPairsSelectBracketedEnvironment(Bracket bracket, MatrixEnvironment environment) {
		MatrixLayout layout = resolver.resolveMatrix(DelimiterMarker.of(bracket), DelimiterMarker.of(bracket));

		assertThat(layout.environment()).isEqualTo(environment);
		assertThat(layout.outer().sized()).isFalse();
	}

	@Test
	void matrixWithoutMarkersIsPlain() {
		MatrixLayout layout = resolver.resolveMatrix(DelimiterMarker.NONE, DelimiterMarker.NONE);

		assertThat(layout.environment()).isEqualTo(MatrixEnvironment.MATRIX);
		assertThat(layout.outer().sized()).isFalse();
	}

	@Test
	void mixedPairKeepsSizedDelimitersAroundPlainMatrix() {
		MatrixLayout layout = resolver.resolveMatrix(DelimiterMarker.of(Bracket.CURLY), DelimiterMarker.NONE);

		assertThat(layout.environment()).isEqualTo(MatrixEnvironment.MATRIX);
		assertThat(layout.outer().left()).isEqualTo("\\left\\{");
		assertThat(layout.outer().right()).isEqualTo("\\right.");
	}
}
