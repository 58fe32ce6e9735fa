package org.javai.mathtex.omml;

import static org.javai.mathtex.omml.OmmlNamespaces.isMath;
import static org.javai.mathtex.omml.OmmlNamespaces.isWord;
import static org.javai.mathtex.omml.OmmlNamespaces.localName;
import static org.javai.mathtex.omml.OmmlNamespaces.val;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.javai.mathtex.ast.AccentKind;
import org.javai.mathtex.ast.DelimiterMarker;
import org.javai.mathtex.ast.EnclosureKind;
import org.javai.mathtex.ast.FractionKind;
import org.javai.mathtex.ast.LimitPlacement;
import org.javai.mathtex.ast.LimitPosition;
import org.javai.mathtex.ast.MathNode;
import org.javai.mathtex.ast.MathVariant;
import org.javai.mathtex.diag.DiagnosticKind;
import org.javai.mathtex.diag.Diagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Converts one OMML formula element tree into a Math AST.
 *
 * Dispatch is by element local name, one handler per construct. Handlers build their
 * children first and validate arity before constructing a node. A missing required part,
 * an unknown element or nesting past the depth cap never raises: the affected subtree
 * becomes {@link MathNode.DegradedText} holding its literal text, a diagnostic is reported,
 * and the siblings are parsed as usual.
 *
 * The parser holds no per-formula state and may be shared between threads.
 */
public class FormulaTreeParser {

	private static final Logger logger = LoggerFactory.getLogger(FormulaTreeParser.class);

	public static final int DEFAULT_MAX_DEPTH = 64;

	/**
	 * Upper bound on the literal text salvaged from one subtree.
	 */
	public static final int MAX_TEXT_LENGTH = 4096;

	private static final String DEFAULT_NARY_CHAR = "∫";
	private static final String DEFAULT_ACCENT_CHAR = "\u0302";
	private static final String DEFAULT_SEPARATOR = "|";

	private final int maxDepth;

	public FormulaTreeParser() {
		this(DEFAULT_MAX_DEPTH);
	}

	public FormulaTreeParser(int maxDepth) {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be positive");
		}
		this.maxDepth = maxDepth;
	}

	public int maxDepth() {
		return maxDepth;
	}

	/**
	 * Parse a formula element ({@code m:oMath}, {@code m:oMathPara} or any single OMML construct).
	 *
	 * @return the formula root, always a group
	 */
	public MathNode.Group parse(Element formula, Diagnostics diagnostics) {
		if (isMath(formula) && "oMath".equals(localName(formula))) {
			return new MathNode.Group(sequence(formula, 1, diagnostics));
		}
		if (isMath(formula) && "oMathPara".equals(localName(formula))) {
			List<MathNode> lines = new ArrayList<>();
			for (Element child : elementChildren(formula)) {
				if (isMath(child) && "oMath".equals(localName(child))) {
					lines.add(new MathNode.Group(sequence(child, 2, diagnostics)));
				}
			}
			if (lines.isEmpty()) {
				return new MathNode.Group(List.of());
			}
			if (lines.size() == 1) {
				return (MathNode.Group) lines.get(0);
			}
			return MathNode.Group.of(new MathNode.EquationArray(lines));
		}
		MathNode node = node(formula, 1, diagnostics);
		return node == null ? new MathNode.Group(List.of()) : MathNode.Group.of(node);
	}

	/**
	 * Convert one element, or return {@code null} for elements that carry no content
	 * (property blocks, bookmarks, empty runs).
	 */
	private MathNode node(Element element, int depth, Diagnostics diagnostics) {
		if (depth > maxDepth) {
			diagnostics.report(DiagnosticKind.DEPTH_EXCEEDED,
					"Nesting deeper than " + maxDepth + " levels at <" + localName(element) + ">; remaining content kept as text");
			logger.debug("Depth cap {} reached at <{}>", maxDepth, localName(element));
			return new MathNode.DegradedText(textOf(element), "depth limit exceeded");
		}
		String tag = localName(element);
		if (!isMath(element)) {
			return foreign(element, tag, diagnostics);
		}
		if (tag.endsWith("Pr")) {
			return null;
		}
		return switch (tag) {
			case "r" -> run(element);
			case "t" -> text(element);
			case "f" -> fraction(element, depth, diagnostics);
			case "rad" -> radical(element, depth, diagnostics);
			case "sSup" -> superscript(element, depth, diagnostics);
			case "sSub" -> subscript(element, depth, diagnostics);
			case "sSubSup" -> subSup(element, depth, diagnostics);
			case "sPre" -> preSubSup(element, depth, diagnostics);
			case "nary" -> nary(element, depth, diagnostics);
			case "d" -> delimiter(element, depth, diagnostics);
			case "m" -> matrix(element, DelimiterMarker.NONE, DelimiterMarker.NONE, depth, diagnostics);
			case "acc" -> accent(element, depth, diagnostics);
			case "bar" -> bar(element, depth, diagnostics);
			case "groupChr" -> groupChar(element, depth, diagnostics);
			case "limLow" -> limit(element, LimitPosition.LOWER, depth, diagnostics);
			case "limUpp" -> limit(element, LimitPosition.UPPER, depth, diagnostics);
			case "func" -> function(element, depth, diagnostics);
			case "eqArr" -> equationArray(element, depth, diagnostics);
			case "box" -> box(element, depth, diagnostics);
			case "borderBox" -> enclosed(element, EnclosureKind.BOXED, depth, diagnostics);
			case "phant" -> phantom(element, depth, diagnostics);
			case "oMath" -> new MathNode.Group(sequence(element, depth + 1, diagnostics));
			// argument containers reached directly behave like groups
			case "e", "num", "den", "sub", "sup", "deg", "lim", "fName" -> argument(element, depth, diagnostics);
			default -> unrecognized(element, tag, diagnostics);
		};
	}

	// === Leaves ===

	private MathNode run(Element element) {
		String text = runText(element);
		if (text.isEmpty()) {
			return null;
		}
		return new MathNode.Run(text, variantOf(firstChild(element, "rPr")));
	}

	private MathNode text(Element element) {
		String text = collectText(element, true);
		return text.isEmpty() ? null : new MathNode.Run(text);
	}

	private MathNode foreign(Element element, String tag, Diagnostics diagnostics) {
		if (isWord(element) && "r".equals(tag)) {
			String text = textOf(element);
			return text.isEmpty() ? null : new MathNode.Run(text, MathVariant.NORMAL_TEXT);
		}
		String text = textOf(element);
		if (text.isEmpty()) {
			// bookmarks, proofing marks and other markers without content
			return null;
		}
		return unrecognized(element, tag, diagnostics);
	}

	private MathNode unrecognized(Element element, String tag, Diagnostics diagnostics) {
		diagnostics.report(DiagnosticKind.UNRECOGNIZED_ELEMENT, "Unrecognized element <" + tag + ">; kept as text");
		logger.debug("No handler for <{}>", tag);
		return new MathNode.DegradedText(textOf(element), "unrecognized element " + tag);
	}

	// === Structures ===

	private MathNode fraction(Element element, int depth, Diagnostics diagnostics) {
		Element num = firstChild(element, "num");
		Element den = firstChild(element, "den");
		if (num == null || den == null) {
			return malformed(element, "fraction is missing its " + (num == null ? "numerator" : "denominator"), diagnostics);
		}
		FractionKind kind = switch (String.valueOf(property(element, "fPr", "type"))) {
			case "lin" -> FractionKind.LINEAR;
			case "skw" -> FractionKind.SKEWED;
			case "noBar" -> FractionKind.NO_BAR;
			default -> FractionKind.BAR;
		};
		return new MathNode.Fraction(argument(num, depth, diagnostics), argument(den, depth, diagnostics), kind);
	}

	private MathNode radical(Element element, int depth, Diagnostics diagnostics) {
		Element base = firstChild(element, "e");
		if (base == null) {
			return malformed(element, "radical is missing its radicand", diagnostics);
		}
		Element deg = firstChild(element, "deg");
		Optional<MathNode> degree = Optional.empty();
		if (deg != null && !flag(element, "radPr", "degHide") && hasContent(deg)) {
			degree = Optional.of(argument(deg, depth, diagnostics));
		}
		return new MathNode.Radical(argument(base, depth, diagnostics), degree);
	}

	private MathNode superscript(Element element, int depth, Diagnostics diagnostics) {
		Element base = firstChild(element, "e");
		Element sup = firstChild(element, "sup");
		if (base == null || sup == null) {
			return malformed(element, "superscript needs a base and an exponent", diagnostics);
		}
		return new MathNode.Superscript(argument(base, depth, diagnostics), argument(sup, depth, diagnostics));
	}

	private MathNode subscript(Element element, int depth, Diagnostics diagnostics) {
		Element base = firstChild(element, "e");
		Element sub = firstChild(element, "sub");
		if (base == null || sub == null) {
			return malformed(element, "subscript needs a base and a subscript", diagnostics);
		}
		return new MathNode.Subscript(argument(base, depth, diagnostics), argument(sub, depth, diagnostics));
	}

	private MathNode subSup(Element element, int depth, Diagnostics diagnostics) {
		Element base = firstChild(element, "e");
		Element sub = firstChild(element, "sub");
		Element sup = firstChild(element, "sup");
		if (base == null || sub == null || sup == null) {
			return malformed(element, "sub-superscript needs a base, a subscript and a superscript", diagnostics);
		}
		return new MathNode.SubSup(argument(base, depth, diagnostics), argument(sub, depth, diagnostics),
				argument(sup, depth, diagnostics));
	}

	private MathNode preSubSup(Element element, int depth, Diagnostics diagnostics) {
		Element base = firstChild(element, "e");
		Element sub = firstChild(element, "sub");
		Element sup = firstChild(element, "sup");
		if (base == null || sub == null || sup == null) {
			return malformed(element, "pre-script needs a base, a subscript and a superscript", diagnostics);
		}
		return new MathNode.PreSubSup(argument(base, depth, diagnostics), argument(sub, depth, diagnostics),
				argument(sup, depth, diagnostics));
	}

	private MathNode nary(Element element, int depth, Diagnostics diagnostics) {
		Element operand = firstChild(element, "e");
		if (operand == null) {
			return malformed(element, "n-ary operator is missing its operand", diagnostics);
		}
		String chr = property(element, "naryPr", "chr");
		String operator = chr == null || chr.isEmpty() ? DEFAULT_NARY_CHAR : chr;
		LimitPlacement placement = switch (String.valueOf(property(element, "naryPr", "limLoc"))) {
			case "undOvr" -> LimitPlacement.UNDER_OVER;
			case "subSup" -> LimitPlacement.SUB_SUP;
			default -> LimitPlacement.DEFAULT;
		};
		Optional<MathNode> lower = optionalLimit(element, "sub", "subHide", depth, diagnostics);
		Optional<MathNode> upper = optionalLimit(element, "sup", "supHide", depth, diagnostics);
		return new MathNode.NaryOperator(operator, lower, upper, argument(operand, depth, diagnostics), placement);
	}

	private Optional<MathNode> optionalLimit(Element nary, String tag, String hideFlag, int depth,
			Diagnostics diagnostics) {
		Element limit = firstChild(nary, tag);
		if (limit == null || !hasContent(limit) || flag(nary, "naryPr", hideFlag)) {
			return Optional.empty();
		}
		return Optional.of(argument(limit, depth, diagnostics));
	}

	private MathNode delimiter(Element element, int depth, Diagnostics diagnostics) {
		String beg = property(element, "dPr", "begChr");
		String end = property(element, "dPr", "endChr");
		String sep = property(element, "dPr", "sepChr");
		DelimiterMarker open = marker(beg == null ? "(" : beg, true, diagnostics);
		DelimiterMarker close = marker(end == null ? ")" : end, false, diagnostics);

		List<Element> items = children(element, "e");
		if (items.size() == 1) {
			List<Element> content = contentChildren(items.get(0));
			if (content.size() == 1 && isMath(content.get(0)) && "m".equals(localName(content.get(0)))) {
				return matrix(content.get(0), open, close, depth + 1, diagnostics);
			}
		}
		List<MathNode> parsed = new ArrayList<>();
		for (Element item : items) {
			parsed.add(argument(item, depth, diagnostics));
		}
		return new MathNode.Delimited(parsed, open, close, sep == null ? DEFAULT_SEPARATOR : sep);
	}

	private DelimiterMarker marker(String glyph, boolean openingSide, Diagnostics diagnostics) {
		return DelimiterMarker.fromGlyph(glyph, openingSide).orElseGet(() -> {
			diagnostics.report(DiagnosticKind.UNRECOGNIZED_DELIMITER,
					"Unrecognized " + (openingSide ? "opening" : "closing") + " delimiter '" + glyph + "'; treated as invisible");
			return DelimiterMarker.NONE;
		});
	}

	private MathNode matrix(Element element, DelimiterMarker open, DelimiterMarker close, int depth,
			Diagnostics diagnostics) {
		List<List<MathNode>> rows = new ArrayList<>();
		int columns = -1;
		for (Element mr : children(element, "mr")) {
			List<Element> cells = children(mr, "e");
			if (cells.isEmpty() || (columns >= 0 && cells.size() != columns)) {
				return malformed(element, "matrix rows are empty or of unequal length", diagnostics);
			}
			columns = cells.size();
			List<MathNode> row = new ArrayList<>();
			for (Element cell : cells) {
				row.add(argument(cell, depth + 1, diagnostics));
			}
			rows.add(row);
		}
		if (rows.isEmpty()) {
			return malformed(element, "matrix has no rows", diagnostics);
		}
		return new MathNode.Matrix(rows, open, close);
	}

	private MathNode accent(Element element, int depth, Diagnostics diagnostics) {
		Element base = firstChild(element, "e");
		if (base == null) {
			return malformed(element, "accent is missing its base", diagnostics);
		}
		String chr = property(element, "accPr", "chr");
		String glyph = chr == null || chr.isEmpty() ? DEFAULT_ACCENT_CHAR : chr;
		AccentKind kind = AccentKind.fromGlyph(glyph).orElse(AccentKind.UNKNOWN);
		return new MathNode.Accent(argument(base, depth, diagnostics), kind, glyph);
	}

	private MathNode bar(Element element, int depth, Diagnostics diagnostics) {
		Element base = firstChild(element, "e");
		if (base == null) {
			return malformed(element, "bar is missing its base", diagnostics);
		}
		AccentKind kind = "bot".equals(property(element, "barPr", "pos")) ? AccentKind.UNDERLINE : AccentKind.OVERLINE;
		return new MathNode.Accent(argument(base, depth, diagnostics), kind);
	}

	private MathNode groupChar(Element element, int depth, Diagnostics diagnostics) {
		Element base = firstChild(element, "e");
		if (base == null) {
			return malformed(element, "group character is missing its base", diagnostics);
		}
		String chr = property(element, "groupChrPr", "chr");
		String pos = property(element, "groupChrPr", "pos");
		boolean over = AccentKind.OVERBRACE.glyph().equals(chr) || "top".equals(pos);
		return new MathNode.Accent(argument(base, depth, diagnostics), over ? AccentKind.OVERBRACE : AccentKind.UNDERBRACE);
	}

	private MathNode limit(Element element, LimitPosition position, int depth, Diagnostics diagnostics) {
		Element base = firstChild(element, "e");
		Element lim = firstChild(element, "lim");
		if (base == null || lim == null) {
			return malformed(element, "limit expression needs a base and a limit", diagnostics);
		}
		return new MathNode.LimitExpr(argument(base, depth, diagnostics), argument(lim, depth, diagnostics), position);
	}

	private MathNode function(Element element, int depth, Diagnostics diagnostics) {
		Element name = firstChild(element, "fName");
		Element arg = firstChild(element, "e");
		if (name == null || arg == null) {
			return malformed(element, "function needs a name and an argument", diagnostics);
		}
		return new MathNode.FunctionApply(argument(name, depth, diagnostics), argument(arg, depth, diagnostics));
	}

	private MathNode equationArray(Element element, int depth, Diagnostics diagnostics) {
		List<MathNode> rows = new ArrayList<>();
		for (Element row : children(element, "e")) {
			rows.add(argument(row, depth, diagnostics));
		}
		if (rows.isEmpty()) {
			return malformed(element, "equation array has no rows", diagnostics);
		}
		return new MathNode.EquationArray(rows);
	}

	private MathNode box(Element element, int depth, Diagnostics diagnostics) {
		Element base = firstChild(element, "e");
		if (base == null) {
			return malformed(element, "box is missing its content", diagnostics);
		}
		return argument(base, depth, diagnostics);
	}

	private MathNode enclosed(Element element, EnclosureKind kind, int depth, Diagnostics diagnostics) {
		Element base = firstChild(element, "e");
		if (base == null) {
			return malformed(element, "enclosure is missing its content", diagnostics);
		}
		return new MathNode.Enclosed(argument(base, depth, diagnostics), kind);
	}

	private MathNode phantom(Element element, int depth, Diagnostics diagnostics) {
		if (flag(element, "phantPr", "show")) {
			return box(element, depth, diagnostics);
		}
		return enclosed(element, EnclosureKind.PHANTOM, depth, diagnostics);
	}

	private MathNode malformed(Element element, String reason, Diagnostics diagnostics) {
		diagnostics.report(DiagnosticKind.MALFORMED_SHAPE, reason);
		logger.debug("Malformed <{}>: {}", localName(element), reason);
		return new MathNode.DegradedText(textOf(element), reason);
	}

	// === Arguments ===

	/**
	 * Parse an argument container ({@code m:e}, {@code m:num}, ...). A single child is returned
	 * as is, anything else as a group.
	 */
	private MathNode argument(Element container, int depth, Diagnostics diagnostics) {
		List<MathNode> nodes = sequence(container, depth + 1, diagnostics);
		return nodes.size() == 1 ? nodes.get(0) : new MathNode.Group(nodes);
	}

	private List<MathNode> sequence(Element container, int depth, Diagnostics diagnostics) {
		List<MathNode> nodes = new ArrayList<>();
		for (Element child : elementChildren(container)) {
			MathNode node = node(child, depth, diagnostics);
			if (node != null) {
				nodes.add(node);
			}
		}
		return nodes;
	}

	// === Run properties ===

	private MathVariant variantOf(Element rPr) {
		if (rPr == null) {
			return MathVariant.DEFAULT;
		}
		if (isOn(firstChild(rPr, "nor"))) {
			return MathVariant.NORMAL_TEXT;
		}
		String scr = valueOf(firstChild(rPr, "scr"));
		String sty = valueOf(firstChild(rPr, "sty"));
		if (scr != null) {
			switch (scr) {
				case "script" -> {
					return MathVariant.SCRIPT;
				}
				case "fraktur" -> {
					return MathVariant.FRAKTUR;
				}
				case "double-struck" -> {
					return MathVariant.DOUBLE_STRUCK;
				}
				case "sans-serif" -> {
					return MathVariant.SANS_SERIF;
				}
				case "monospace" -> {
					return MathVariant.MONOSPACE;
				}
				default -> {
					// roman: the style decides
				}
			}
		}
		if (sty == null) {
			return MathVariant.DEFAULT;
		}
		return switch (sty) {
			case "p" -> MathVariant.ROMAN;
			case "b" -> MathVariant.BOLD;
			case "i" -> MathVariant.ITALIC;
			case "bi" -> MathVariant.BOLD_ITALIC;
			default -> MathVariant.DEFAULT;
		};
	}

	// === DOM helpers ===

	private static String runText(Element run) {
		StringBuilder sb = new StringBuilder();
		for (Element child : elementChildren(run)) {
			if ("t".equals(localName(child))) {
				sb.append(collectText(child, true));
			}
		}
		return sb.toString();
	}

	/**
	 * Concatenation of every text element below the given element, in document order, cut off
	 * at {@link #MAX_TEXT_LENGTH} characters.
	 */
	public static String textOf(Element element) {
		return collectText(element, false);
	}

	/**
	 * Iterative walk over the subtree: nesting depth is bounded by the heap, not the thread stack.
	 * Text nodes count once {@code inText} is set or a text element has been entered.
	 */
	private static String collectText(Element root, boolean inText) {
		StringBuilder sb = new StringBuilder();
		Deque<TextCursor> pending = new ArrayDeque<>();
		pending.push(new TextCursor(root, inText));
		while (!pending.isEmpty() && sb.length() < MAX_TEXT_LENGTH) {
			TextCursor cursor = pending.pop();
			Node node = cursor.node();
			short type = node.getNodeType();
			if (type == Node.TEXT_NODE || type == Node.CDATA_SECTION_NODE) {
				if (cursor.inText()) {
					sb.append(node.getNodeValue());
				}
				continue;
			}
			if (type != Node.ELEMENT_NODE) {
				continue;
			}
			boolean text = cursor.inText() || isTextElement((Element) node);
			// pushed last to first so that the first child is popped first
			for (Node child = node.getLastChild(); child != null; child = child.getPreviousSibling()) {
				pending.push(new TextCursor(child, text));
			}
		}
		if (sb.length() > MAX_TEXT_LENGTH) {
			sb.setLength(MAX_TEXT_LENGTH);
		}
		return sb.toString();
	}

	private static boolean isTextElement(Element element) {
		return "t".equals(localName(element)) && (isMath(element) || isWord(element));
	}

	private record TextCursor(Node node, boolean inText) {
	}

	private static List<Element> elementChildren(Element parent) {
		List<Element> result = new ArrayList<>();
		NodeList nodes = parent.getChildNodes();
		for (int i = 0; i < nodes.getLength(); i++) {
			Node node = nodes.item(i);
			if (node.getNodeType() == Node.ELEMENT_NODE) {
				result.add((Element) node);
			}
		}
		return result;
	}

	private static List<Element> children(Element parent, String localName) {
		List<Element> result = new ArrayList<>();
		for (Element child : elementChildren(parent)) {
			if (isMath(child) && localName.equals(localName(child))) {
				result.add(child);
			}
		}
		return result;
	}

	private static Element firstChild(Element parent, String localName) {
		for (Element child : elementChildren(parent)) {
			if (isMath(child) && localName.equals(localName(child))) {
				return child;
			}
		}
		return null;
	}

	/**
	 * Children that carry content, skipping property blocks such as {@code m:ctrlPr}.
	 */
	private static List<Element> contentChildren(Element parent) {
		List<Element> result = new ArrayList<>();
		for (Element child : elementChildren(parent)) {
			if (!localName(child).endsWith("Pr")) {
				result.add(child);
			}
		}
		return result;
	}

	private static boolean hasContent(Element container) {
		return !contentChildren(container).isEmpty();
	}

	/**
	 * Read {@code <propertyBlock><setting m:val="..."/></propertyBlock>} from an element.
	 */
	private static String property(Element element, String propertyBlock, String setting) {
		Element block = firstChild(element, propertyBlock);
		return block == null ? null : valueOf(firstChild(block, setting));
	}

	private static String valueOf(Element setting) {
		return setting == null ? null : val(setting);
	}

	private static boolean flag(Element element, String propertyBlock, String setting) {
		Element block = firstChild(element, propertyBlock);
		return block != null && isOn(firstChild(block, setting));
	}

	/**
	 * OMML on/off settings: a setting element without a value counts as on.
	 */
	private static boolean isOn(Element setting) {
		if (setting == null) {
			return false;
		}
		String value = val(setting);
		if (value == null || value.isEmpty()) {
			return true;
		}
		return switch (value) {
			case "1", "on", "true" -> true;
			default -> false;
		};
	}
}
