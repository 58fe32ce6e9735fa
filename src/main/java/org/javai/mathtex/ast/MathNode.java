package org.javai.mathtex.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A node in the Math AST built from one formula tree.
 *
 * The set of variants is closed. Every consumer walks the tree through
 * {@link #accept(MathNodeVisitor)}, so adding a variant forces every visitor to handle it.
 * Trees are built bottom-up, are never shared between formulas, and are discarded once emitted.
 */
public sealed interface MathNode {

	<R> R accept(MathNodeVisitor<R> visitor);

	/**
	 * Leaf holding literal text or symbols, with the source-declared typeface.
	 */
	record Run(String text, MathVariant variant) implements MathNode {

		public Run {
			Objects.requireNonNull(text, "text must not be null");
			variant = variant != null ? variant : MathVariant.DEFAULT;
		}

		public Run(String text) {
			this(text, MathVariant.DEFAULT);
		}

		@Override
		public <R> R accept(MathNodeVisitor<R> visitor) {
			return visitor.visitRun(this);
		}
	}

	/**
	 * Plain sequence of nodes. Also the root of every formula.
	 */
	record Group(List<MathNode> children) implements MathNode {

		public Group {
			children = children != null ? List.copyOf(children) : List.of();
		}

		public static Group of(MathNode... children) {
			return new Group(List.of(children));
		}

		@Override
		public <R> R accept(MathNodeVisitor<R> visitor) {
			return visitor.visitGroup(this);
		}
	}

	record Fraction(MathNode numerator, MathNode denominator, FractionKind kind) implements MathNode {

		public Fraction {
			Objects.requireNonNull(numerator, "numerator must not be null");
			Objects.requireNonNull(denominator, "denominator must not be null");
			kind = kind != null ? kind : FractionKind.BAR;
		}

		public Fraction(MathNode numerator, MathNode denominator) {
			this(numerator, denominator, FractionKind.BAR);
		}

		@Override
		public <R> R accept(MathNodeVisitor<R> visitor) {
			return visitor.visitFraction(this);
		}
	}

	/**
	 * Root of a radicand. An absent degree is a square root.
	 */
	record Radical(MathNode radicand, Optional<MathNode> degree) implements MathNode {

		public Radical {
			Objects.requireNonNull(radicand, "radicand must not be null");
			degree = degree != null ? degree : Optional.empty();
		}

		@Override
		public <R> R accept(MathNodeVisitor<R> visitor) {
			return visitor.visitRadical(this);
		}
	}

	record Superscript(MathNode base, MathNode exponent) implements MathNode {

		public Superscript {
			Objects.requireNonNull(base, "base must not be null");
			Objects.requireNonNull(exponent, "exponent must not be null");
		}

		@Override
		public <R> R accept(MathNodeVisitor<R> visitor) {
			return visitor.visitSuperscript(this);
		}
	}

	record Subscript(MathNode base, MathNode subscript) implements MathNode {

		public Subscript {
			Objects.requireNonNull(base, "base must not be null");
			Objects.requireNonNull(subscript, "subscript must not be null");
		}

		@Override
		public <R> R accept(MathNodeVisitor<R> visitor) {
			return visitor.visitSubscript(this);
		}
	}

	/**
	 * Both scripts attached to one base. Emitted as a single combined script group.
	 */
	record SubSup(MathNode base, MathNode subscript, MathNode superscript) implements MathNode {

		public SubSup {
			Objects.requireNonNull(base, "base must not be null");
			Objects.requireNonNull(subscript, "subscript must not be null");
			Objects.requireNonNull(superscript, "superscript must not be null");
		}

		@Override
		public <R> R accept(MathNodeVisitor<R> visitor) {
			return visitor.visitSubSup(this);
		}
	}

	/**
	 * Scripts written before the base, as in isotope notation.
	 */
	record PreSubSup(MathNode base, MathNode subscript, MathNode superscript) implements MathNode {

		public PreSubSup {
			Objects.requireNonNull(base, "base must not be null");
			Objects.requireNonNull(subscript, "subscript must not be null");
			Objects.requireNonNull(superscript, "superscript must not be null");
		}

		@Override
		public <R> R accept(MathNodeVisitor<R> visitor) {
			return visitor.visitPreSubSup(this);
		}
	}

	/**
	 * Big operator (sum, integral, product, union...) with optional limits and an operand.
	 *
	 * @param operator the operator glyph as written in the source, e.g. {@code "∑"}
	 * @param placement where the source asked the limits to go
	 */
	record NaryOperator(
			String operator,
			Optional<MathNode> lower,
			Optional<MathNode> upper,
			MathNode operand,
			LimitPlacement placement
	) implements MathNode {

		public NaryOperator {
			Objects.requireNonNull(operator, "operator must not be null");
			Objects.requireNonNull(operand, "operand must not be null");
			lower = lower != null ? lower : Optional.empty();
			upper = upper != null ? upper : Optional.empty();
			placement = placement != null ? placement : LimitPlacement.DEFAULT;
		}

		public NaryOperator(String operator, Optional<MathNode> lower, Optional<MathNode> upper, MathNode operand) {
			this(operator, lower, upper, operand, LimitPlacement.DEFAULT);
		}

		@Override
		public <R> R accept(MathNodeVisitor<R> visitor) {
			return visitor.visitNaryOperator(this);
		}
	}

	/**
	 * Bracketed sub-expression. The items are joined by the separator glyph and wrapped
	 * in the open and close markers, either of which may be invisible.
	 */
	record Delimited(
			List<MathNode> items,
			DelimiterMarker open,
			DelimiterMarker close,
			String separator
	) implements MathNode {

		public Delimited {
			items = items != null ? List.copyOf(items) : List.of();
			open = open != null ? open : DelimiterMarker.NONE;
			close = close != null ? close : DelimiterMarker.NONE;
			separator = separator != null ? separator : "";
		}

		public Delimited(MathNode body, DelimiterMarker open, DelimiterMarker close) {
			this(List.of(body), open, close, "");
		}

		@Override
		public <R> R accept(MathNodeVisitor<R> visitor) {
			return visitor.visitDelimited(this);
		}
	}

	/**
	 * Rectangular grid of cells, optionally carrying the delimiters that enclosed it in the source.
	 */
	record Matrix(List<List<MathNode>> rows, DelimiterMarker open, DelimiterMarker close) implements MathNode {

		public Matrix {
			Objects.requireNonNull(rows, "rows must not be null");
			rows = rows.stream().map(List::copyOf).toList();
			if (rows.isEmpty()) {
				throw new IllegalArgumentException("Matrix must have at least one row");
			}
			int columns = rows.get(0).size();
			for (List<MathNode> row : rows) {
				if (row.size() != columns || row.isEmpty()) {
					throw new IllegalArgumentException("Matrix rows must be non-empty and of equal length");
				}
			}
			open = open != null ? open : DelimiterMarker.NONE;
			close = close != null ? close : DelimiterMarker.NONE;
		}

		public Matrix(List<List<MathNode>> rows) {
			this(rows, DelimiterMarker.NONE, DelimiterMarker.NONE);
		}

		@Override
		public <R> R accept(MathNodeVisitor<R> visitor) {
			return visitor.visitMatrix(this);
		}
	}

	/**
	 * Accent or over/under decoration.
	 *
	 * @param sourceGlyph the accent character from the source, kept for diagnostics when the kind is unknown
	 */
	record Accent(MathNode base, AccentKind kind, String sourceGlyph) implements MathNode {

		public Accent {
			Objects.requireNonNull(base, "base must not be null");
			kind = kind != null ? kind : AccentKind.UNKNOWN;
			sourceGlyph = sourceGlyph != null ? sourceGlyph : "";
		}

		public Accent(MathNode base, AccentKind kind) {
			this(base, kind, kind.glyph());
		}

		@Override
		public <R> R accept(MathNodeVisitor<R> visitor) {
			return visitor.visitAccent(this);
		}
	}

	/**
	 * A base such as {@code lim} with a limit condition placed below (or above) it.
	 */
	record LimitExpr(MathNode base, MathNode limit, LimitPosition position) implements MathNode {

		public LimitExpr {
			Objects.requireNonNull(base, "base must not be null");
			Objects.requireNonNull(limit, "limit must not be null");
			position = position != null ? position : LimitPosition.LOWER;
		}

		public LimitExpr(MathNode base, MathNode limit) {
			this(base, limit, LimitPosition.LOWER);
		}

		@Override
		public <R> R accept(MathNodeVisitor<R> visitor) {
			return visitor.visitLimitExpr(this);
		}
	}

	record FunctionApply(MathNode name, MathNode argument) implements MathNode {

		public FunctionApply {
			Objects.requireNonNull(name, "name must not be null");
			Objects.requireNonNull(argument, "argument must not be null");
		}

		@Override
		public <R> R accept(MathNodeVisitor<R> visitor) {
			return visitor.visitFunctionApply(this);
		}
	}

	/**
	 * Vertically stacked equations.
	 */
	record EquationArray(List<MathNode> rows) implements MathNode {

		public EquationArray {
			rows = rows != null ? List.copyOf(rows) : List.of();
		}

		@Override
		public <R> R accept(MathNodeVisitor<R> visitor) {
			return visitor.visitEquationArray(this);
		}
	}

	record Enclosed(MathNode body, EnclosureKind kind) implements MathNode {

		public Enclosed {
			Objects.requireNonNull(body, "body must not be null");
			Objects.requireNonNull(kind, "kind must not be null");
		}

		@Override
		public <R> R accept(MathNodeVisitor<R> visitor) {
			return visitor.visitEnclosed(this);
		}
	}

	/**
	 * Best-effort text salvaged from a subtree that could not be converted structurally.
	 * An empty salvage means nothing could be recovered.
	 */
	record DegradedText(String salvaged, String reason) implements MathNode {

		public DegradedText {
			salvaged = salvaged != null ? salvaged : "";
			reason = reason != null ? reason : "";
		}

		public boolean recovered() {
			return !salvaged.isBlank();
		}

		@Override
		public <R> R accept(MathNodeVisitor<R> visitor) {
			return visitor.visitDegradedText(this);
		}
	}
}
