package org.javai.mathtex.emit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.javai.mathtex.ast.AccentKind;
import org.javai.mathtex.ast.DelimiterMarker;
import org.javai.mathtex.ast.EnclosureKind;
import org.javai.mathtex.ast.LimitPlacement;
import org.javai.mathtex.ast.LimitPosition;
import org.javai.mathtex.ast.MathNode;
import org.javai.mathtex.ast.MathNodeVisitor;
import org.javai.mathtex.ast.MathVariant;
import org.javai.mathtex.diag.DiagnosticKind;
import org.javai.mathtex.diag.Diagnostics;
import org.javai.mathtex.symbol.SymbolEntry;
import org.javai.mathtex.symbol.SymbolTable;

/**
 * Visitor that generates a LaTeX math fragment from a Math AST.
 *
 * Each visit returns the complete fragment for its subtree, built from the fragments of its
 * children, so composition never re-escapes text. The same tree, table and mode always
 * produce the same string.
 */
public class LatexEmitter implements MathNodeVisitor<String> {

	private static final Set<String> INTEGRALS = Set.of("\\int", "\\iint", "\\iiint", "\\oint");

	private final SymbolTable symbols;
	private final DelimiterResolver delimiters;
	private final EmitMode mode;
	private final Diagnostics diagnostics;
	private final SortedSet<String> requiredPackages = new TreeSet<>();

	public LatexEmitter(SymbolTable symbols, EmitMode mode, Diagnostics diagnostics) {
		this.symbols = symbols;
		this.delimiters = new DelimiterResolver(symbols);
		this.mode = mode != null ? mode : EmitMode.INLINE;
		this.diagnostics = diagnostics;
	}

	/**
	 * Generate an inline fragment with the standard symbol table.
	 */
	public static String generate(MathNode node) {
		return new LatexEmitter(SymbolTable.standard(), EmitMode.INLINE, Diagnostics.detached()).emit(node);
	}

	public String emit(MathNode node) {
		return node.accept(this);
	}

	/**
	 * LaTeX packages needed by everything emitted so far, sorted by name.
	 */
	public SortedSet<String> requiredPackages() {
		return Collections.unmodifiableSortedSet(requiredPackages);
	}

	@Override
	public String visitRun(MathNode.Run run) {
		String text = run.text();
		if (text.isEmpty()) {
			return "";
		}
		if (run.variant() == MathVariant.NORMAL_TEXT) {
			requiredPackages.add("amsmath");
			return "\\text{" + LatexEscaper.escapeText(text) + "}";
		}
		Optional<SymbolEntry> function = recognizedFunction(run);
		if (function.isPresent()) {
			return functionToken(function.get());
		}

		String style = styleCommand(run.variant());
		LatexBuilder out = new LatexBuilder();
		StringBuilder styled = new StringBuilder();
		text.codePoints().forEach(cp -> {
			if (symbols.isInvisible(cp)) {
				return;
			}
			if (style != null && Character.isLetterOrDigit(cp) && symbols.lookup(cp).isEmpty()) {
				styled.appendCodePoint(cp);
				return;
			}
			flushStyled(out, style, styled);
			out.append(symbolToken(cp));
		});
		flushStyled(out, style, styled);
		return out.toString();
	}

	@Override
	public String visitGroup(MathNode.Group group) {
		LatexBuilder out = new LatexBuilder();
		for (MathNode child : group.children()) {
			out.append(child.accept(this));
		}
		return out.toString();
	}

	@Override
	public String visitFraction(MathNode.Fraction fraction) {
		String numerator = fraction.numerator().accept(this);
		String denominator = fraction.denominator().accept(this);
		return switch (fraction.kind()) {
			case BAR -> "\\frac{" + numerator + "}{" + denominator + "}";
			case LINEAR, SKEWED -> "{" + numerator + "}/{" + denominator + "}";
			case NO_BAR -> {
				requiredPackages.add("amsmath");
				yield "\\genfrac{}{}{0pt}{}{" + numerator + "}{" + denominator + "}";
			}
		};
	}

	@Override
	public String visitRadical(MathNode.Radical radical) {
		String radicand = radical.radicand().accept(this);
		if (radical.degree().isPresent()) {
			String degree = radical.degree().get().accept(this);
			if (!degree.isBlank()) {
				return "\\sqrt[" + degree + "]{" + radicand + "}";
			}
		}
		return "\\sqrt{" + radicand + "}";
	}

	@Override
	public String visitSuperscript(MathNode.Superscript node) {
		return scriptBase(node.base()) + "^{" + node.exponent().accept(this) + "}";
	}

	@Override
	public String visitSubscript(MathNode.Subscript node) {
		return scriptBase(node.base()) + "_{" + node.subscript().accept(this) + "}";
	}

	@Override
	public String visitSubSup(MathNode.SubSup node) {
		return scriptBase(node.base())
				+ "_{" + node.subscript().accept(this) + "}"
				+ "^{" + node.superscript().accept(this) + "}";
	}

	@Override
	public String visitPreSubSup(MathNode.PreSubSup node) {
		String sub = node.subscript().accept(this);
		String sup = node.superscript().accept(this);
		return new LatexBuilder()
				.append("{}_{" + sub + "}^{" + sup + "}")
				.append(node.base().accept(this))
				.toString();
	}

	@Override
	public String visitNaryOperator(MathNode.NaryOperator nary) {
		String operator = naryToken(nary.operator());
		StringBuilder sb = new StringBuilder(operator);
		boolean hasLimits = nary.lower().isPresent() || nary.upper().isPresent();
		if (hasLimits) {
			sb.append(limitsModifier(operator, nary.placement()));
		}
		nary.lower().ifPresent(lower -> sb.append("_{").append(lower.accept(this)).append('}'));
		nary.upper().ifPresent(upper -> sb.append("^{").append(upper.accept(this)).append('}'));
		String operand = nary.operand().accept(this);
		if (!operand.isEmpty()) {
			sb.append(' ').append(operand);
		}
		return sb.toString();
	}

	@Override
	public String visitDelimited(MathNode.Delimited delimited) {
		ResolvedDelimiters resolved = delimiters.resolve(delimited.open(), delimited.close());
		String separator = separatorToken(delimited.separator(), resolved.sized());
		LatexBuilder body = new LatexBuilder();
		List<MathNode> items = delimited.items();
		for (int i = 0; i < items.size(); i++) {
			if (i > 0) {
				body.append(separator);
			}
			body.append(items.get(i).accept(this));
		}
		if (!resolved.sized()) {
			return body.toString();
		}
		return new LatexBuilder()
				.append(resolved.left())
				.append(body.toString())
				.append(resolved.right())
				.toString();
	}

	@Override
	public String visitMatrix(MathNode.Matrix matrix) {
		requiredPackages.add("amsmath");
		MatrixLayout layout = delimiters.resolveMatrix(matrix.open(), matrix.close());
		List<String> rows = new ArrayList<>();
		for (List<MathNode> row : matrix.rows()) {
			List<String> cells = new ArrayList<>();
			for (MathNode cell : row) {
				cells.add(cell.accept(this));
			}
			rows.add(String.join(" & ", cells));
		}
		String body = layout.environment().begin() + " "
				+ String.join(" \\\\ ", rows) + " "
				+ layout.environment().end();
		ResolvedDelimiters outer = layout.outer();
		if (!outer.sized()) {
			return body;
		}
		return outer.left() + " " + body + " " + outer.right();
	}

	@Override
	public String visitAccent(MathNode.Accent accent) {
		AccentKind kind = accent.kind();
		if (kind == AccentKind.UNKNOWN) {
			diagnostics.report(DiagnosticKind.UNRECOGNIZED_ACCENT,
					"Unrecognized accent '" + accent.sourceGlyph() + "'; emitted as a hat");
			kind = AccentKind.HAT;
		}
		String base = accent.base().accept(this);
		boolean wide = !singleCharacter(accent.base());
		return accentCommand(kind, wide) + "{" + base + "}";
	}

	@Override
	public String visitLimitExpr(MathNode.LimitExpr node) {
		String base = node.base().accept(this);
		String limit = node.limit().accept(this);
		boolean upper = node.position() == LimitPosition.UPPER;
		if (takesLimitsAsScripts(node.base(), upper)) {
			return base + (upper ? "^{" : "_{") + limit + "}";
		}
		requiredPackages.add("amsmath");
		return (upper ? "\\overset{" : "\\underset{") + limit + "}{" + base + "}";
	}

	@Override
	public String visitFunctionApply(MathNode.FunctionApply apply) {
		String name = apply.name().accept(this);
		String argument = apply.argument().accept(this);
		if (functionHead(apply.name()).isPresent()) {
			return name + "\\," + argument;
		}
		return new LatexBuilder().append(name).append(argument).toString();
	}

	@Override
	public String visitEquationArray(MathNode.EquationArray array) {
		if (array.rows().isEmpty()) {
			return "";
		}
		requiredPackages.add("amsmath");
		List<String> rows = new ArrayList<>();
		for (MathNode row : array.rows()) {
			rows.add(row.accept(this));
		}
		return "\\begin{aligned} " + String.join(" \\\\ ", rows) + " \\end{aligned}";
	}

	@Override
	public String visitEnclosed(MathNode.Enclosed enclosed) {
		String body = enclosed.body().accept(this);
		if (enclosed.kind() == EnclosureKind.BOXED) {
			requiredPackages.add("amsmath");
			return "\\boxed{" + body + "}";
		}
		return "\\phantom{" + body + "}";
	}

	@Override
	public String visitDegradedText(MathNode.DegradedText degraded) {
		if (!degraded.recovered()) {
			return "";
		}
		return visitRun(new MathNode.Run(degraded.salvaged().strip()));
	}

	// ---- runs and symbols ----

	private String symbolToken(int codePoint) {
		Optional<SymbolEntry> entry = symbols.lookup(codePoint);
		if (entry.isPresent()) {
			requiredPackages.addAll(entry.get().packages());
			return entry.get().token();
		}
		String escaped = LatexEscaper.escapeMath(codePoint);
		return escaped != null ? escaped : new String(Character.toChars(codePoint));
	}

	private String functionToken(SymbolEntry entry) {
		requiredPackages.addAll(entry.packages());
		return entry.token();
	}

	private Optional<SymbolEntry> recognizedFunction(MathNode.Run run) {
		if (run.variant() != MathVariant.DEFAULT && run.variant() != MathVariant.ROMAN) {
			return Optional.empty();
		}
		return symbols.functionName(run.text());
	}

	/**
	 * The recognized function name heading a function's name part: the name itself, or the base
	 * of a limit or script attached to it ({@code lim} under a limit, {@code sin} squared).
	 */
	private Optional<SymbolEntry> functionHead(MathNode name) {
		if (name instanceof MathNode.Run run) {
			return recognizedFunction(run);
		}
		if (name instanceof MathNode.LimitExpr limit) {
			return functionHead(limit.base());
		}
		if (name instanceof MathNode.Superscript sup) {
			return functionHead(sup.base());
		}
		if (name instanceof MathNode.Subscript sub) {
			return functionHead(sub.base());
		}
		if (name instanceof MathNode.Group group && group.children().size() == 1) {
			return functionHead(group.children().get(0));
		}
		return Optional.empty();
	}

	private void flushStyled(LatexBuilder out, String style, StringBuilder styled) {
		if (styled.length() == 0) {
			return;
		}
		out.append(style + "{" + styled + "}");
		styled.setLength(0);
	}

	private String styleCommand(MathVariant variant) {
		return switch (variant) {
			case ROMAN -> "\\mathrm";
			case BOLD -> "\\mathbf";
			case ITALIC -> "\\mathit";
			case BOLD_ITALIC -> {
				requiredPackages.add("amsmath");
				yield "\\boldsymbol";
			}
			case SCRIPT -> "\\mathcal";
			case FRAKTUR -> {
				requiredPackages.add("amssymb");
				yield "\\mathfrak";
			}
			case DOUBLE_STRUCK -> {
				requiredPackages.add("amssymb");
				yield "\\mathbb";
			}
			case SANS_SERIF -> "\\mathsf";
			case MONOSPACE -> "\\mathtt";
			case DEFAULT, NORMAL_TEXT -> null;
		};
	}

	// ---- scripts and operators ----

	private String scriptBase(MathNode base) {
		String text = base.accept(this);
		if (text.isEmpty()) {
			return "{}";
		}
		if (text.codePointCount(0, text.length()) == 1 || takesScriptsBare(base)
				|| (base instanceof MathNode.Delimited && text.startsWith("\\left"))) {
			return text;
		}
		return "{" + text + "}";
	}

	/**
	 * A base that emits as one control word: a recognized function name or a single symbol
	 * whose token is a control word. Composite tokens such as {@code ^{\circ}} need braces.
	 */
	private boolean takesScriptsBare(MathNode base) {
		if (base instanceof MathNode.Group group && group.children().size() == 1) {
			return takesScriptsBare(group.children().get(0));
		}
		if (!(base instanceof MathNode.Run run)) {
			return false;
		}
		if (recognizedFunction(run).isPresent()) {
			return true;
		}
		if (run.variant() == MathVariant.NORMAL_TEXT) {
			return false;
		}
		String text = run.text().strip();
		return text.codePointCount(0, text.length()) == 1
				&& symbols.lookup(text.codePointAt(0)).map(SymbolEntry::controlWord).orElse(false);
	}

	private String naryToken(String operator) {
		if (operator.codePointCount(0, operator.length()) == 1) {
			Optional<SymbolEntry> entry = symbols.lookup(operator.codePointAt(0));
			if (entry.isPresent() && entry.get().largeOperator()) {
				requiredPackages.addAll(entry.get().packages());
				return entry.get().token();
			}
		}
		String text = visitRun(new MathNode.Run(operator));
		return "\\mathop{" + text + "}";
	}

	private String limitsModifier(String operator, LimitPlacement placement) {
		if (placement == LimitPlacement.DEFAULT) {
			return "";
		}
		boolean underOverByDefault = mode == EmitMode.DISPLAY && !INTEGRALS.contains(operator);
		boolean underOver = placement == LimitPlacement.UNDER_OVER;
		if (underOver == underOverByDefault) {
			return "";
		}
		return underOver ? "\\limits" : "\\nolimits";
	}

	private boolean takesLimitsAsScripts(MathNode base, boolean upper) {
		if (base instanceof MathNode.Accent accent) {
			return accent.kind() == (upper ? AccentKind.OVERBRACE : AccentKind.UNDERBRACE);
		}
		return functionHead(base).isPresent();
	}

	// ---- delimiters and accents ----

	private String separatorToken(String separator, boolean sized) {
		if (separator.isEmpty()) {
			return "";
		}
		Optional<DelimiterMarker> marker = DelimiterMarker.fromGlyph(separator, true);
		if (sized && marker.isPresent() && !marker.get().invisible()) {
			return "\\middle" + delimiters.glyph(marker.get(), true);
		}
		if ("|".equals(separator)) {
			return "\\mid";
		}
		LatexBuilder out = new LatexBuilder();
		separator.codePoints().forEach(cp -> out.append(symbolToken(cp)));
		return out.toString();
	}

	private boolean singleCharacter(MathNode base) {
		if (base instanceof MathNode.Run run) {
			String text = run.text().strip();
			return text.codePointCount(0, text.length()) == 1;
		}
		if (base instanceof MathNode.Group group && group.children().size() == 1) {
			return singleCharacter(group.children().get(0));
		}
		return false;
	}

	private String accentCommand(AccentKind kind, boolean wide) {
		return switch (kind) {
			case HAT -> wide ? "\\widehat" : "\\hat";
			case TILDE -> wide ? "\\widetilde" : "\\tilde";
			case BAR -> wide ? "\\overline" : "\\bar";
			case DOT -> "\\dot";
			case DDOT -> "\\ddot";
			case VEC -> wide ? "\\overrightarrow" : "\\vec";
			case LEFT_VEC -> "\\overleftarrow";
			case BREVE -> "\\breve";
			case CHECK -> "\\check";
			case RING -> "\\mathring";
			case GRAVE -> "\\grave";
			case ACUTE -> "\\acute";
			case OVERLINE -> "\\overline";
			case UNDERLINE -> "\\underline";
			case OVERBRACE -> "\\overbrace";
			case UNDERBRACE -> "\\underbrace";
			case UNKNOWN -> wide ? "\\widehat" : "\\hat";
		};
	}
}
