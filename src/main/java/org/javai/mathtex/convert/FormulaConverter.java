package org.javai.mathtex.convert;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.javai.mathtex.ast.MathNode;
import org.javai.mathtex.diag.DiagnosticKind;
import org.javai.mathtex.diag.Diagnostics;
import org.javai.mathtex.emit.EmitMode;
import org.javai.mathtex.emit.LatexEmitter;
import org.javai.mathtex.emit.LatexEscaper;
import org.javai.mathtex.omml.FormulaInput;
import org.javai.mathtex.omml.FormulaLocator;
import org.javai.mathtex.omml.FormulaTreeParser;
import org.javai.mathtex.omml.OmmlReader;
import org.javai.mathtex.symbol.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

/**
 * Converts formulas to LaTeX fragments, one result per formula.
 *
 * Each formula is converted in isolation: nothing that goes wrong inside one formula escapes
 * it, including a stack overflow when a raised depth cap lets nesting run too deep. Problems end up as diagnostics on that formula's result, whose fragment falls back to the
 * formula's literal text and is never empty.
 *
 * Batches keep document order. With a parallelism above one, trees are built on the calling
 * thread (DOM nodes are not safe for concurrent reads) and emission runs on worker threads.
 */
public class FormulaConverter {

	private static final Logger logger = LoggerFactory.getLogger(FormulaConverter.class);

	static final String EMPTY_FRAGMENT = "{}";

	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private final SymbolTable symbols;
	private final FormulaTreeParser parser;
	private final ConversionOptions options;

	/**
	 * A converter configured by the {@code mathtex.yml} found on this class's classpath.
	 */
	public FormulaConverter() {
		this(FormulaConverter.class.getClassLoader());
	}

	/**
	 * A converter configured by the first {@code mathtex.yml} visible to the given class loader,
	 * or by the defaults when there is none.
	 */
	public FormulaConverter(ClassLoader loader) {
		this(new ConversionOptionsLoader().loadResource(ConversionOptionsLoader.DEFAULT_RESOURCE, loader));
	}

	public FormulaConverter(ConversionOptions options) {
		this(SymbolTable.standard(), new FormulaTreeParser(options.maxDepth()), options);
	}

	public FormulaConverter(SymbolTable symbols, FormulaTreeParser parser, ConversionOptions options) {
		this.symbols = Objects.requireNonNull(symbols, "symbols must not be null");
		this.parser = Objects.requireNonNull(parser, "parser must not be null");
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	public ConversionOptions options() {
		return options;
	}

	/**
	 * Convert a single formula outside of any batch.
	 */
	public FormulaResult convert(FormulaInput input) {
		return convert(input, 0);
	}

	public FormulaResult convert(FormulaInput input, int index) {
		return emit(parse(input, index));
	}

	/**
	 * Read an OMML fragment and convert it.
	 *
	 * @throws org.javai.mathtex.omml.OmmlParseException if the text is not well-formed XML
	 */
	public FormulaResult convertXml(String omml, boolean display) {
		Element formula = new OmmlReader().read(omml);
		return convert(new FormulaInput(formula, display));
	}

	/**
	 * Convert every formula in a document body, in document order.
	 */
	public List<FormulaResult> convertDocument(Element body) {
		List<FormulaInput> formulas = FormulaLocator.locate(body);
		logger.debug("Located {} formulas", formulas.size());
		return convertAll(formulas);
	}

	/**
	 * Convert a batch of formulas. The result list is in input order whatever order the
	 * conversions finish in.
	 */
	public List<FormulaResult> convertAll(List<FormulaInput> inputs) {
		List<ParsedFormula> parsed = new ArrayList<>(inputs.size());
		for (int i = 0; i < inputs.size(); i++) {
			parsed.add(parse(inputs.get(i), i));
		}
		List<FormulaResult> results;
		if (options.parallelism() == 1 || parsed.size() < 2) {
			results = new ArrayList<>(parsed.size());
			for (ParsedFormula formula : parsed) {
				results.add(emit(formula));
			}
		} else {
			results = emitInParallel(parsed);
		}
		long degraded = results.stream().filter(FormulaResult::degraded).count();
		if (degraded > 0) {
			logger.info("Converted {} formulas, {} degraded", results.size(), degraded);
		} else {
			logger.debug("Converted {} formulas", results.size());
		}
		return results;
	}

	private List<FormulaResult> emitInParallel(List<ParsedFormula> parsed) {
		int threads = Math.min(options.parallelism(), parsed.size());
		ExecutorService executor = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
		try {
			List<Future<FormulaResult>> futures = new ArrayList<>(parsed.size());
			for (ParsedFormula formula : parsed) {
				futures.add(executor.submit(() -> emit(formula)));
			}
			List<FormulaResult> results = new ArrayList<>(parsed.size());
			for (int i = 0; i < futures.size(); i++) {
				results.add(await(futures.get(i), parsed.get(i)));
			}
			return results;
		} finally {
			executor.shutdownNow();
		}
	}

	private FormulaResult await(Future<FormulaResult> future, ParsedFormula formula) {
		try {
			return future.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while converting formula " + formula.index(), e);
		} catch (ExecutionException e) {
			return failed(formula, e.getCause() != null ? e.getCause() : e);
		}
	}

	private ParsedFormula parse(FormulaInput input, int index) {
		Diagnostics diagnostics = new Diagnostics(index);
		try {
			MathNode.Group root = parser.parse(input.formula(), diagnostics);
			return new ParsedFormula(index, input, root, diagnostics, null);
		} catch (RuntimeException | StackOverflowError e) {
			return new ParsedFormula(index, input, null, diagnostics, e);
		}
	}

	private FormulaResult emit(ParsedFormula formula) {
		if (formula.failure() != null) {
			return failed(formula, formula.failure());
		}
		try {
			LatexEmitter emitter = new LatexEmitter(symbols, EmitMode.of(formula.display()), formula.diagnostics());
			String fragment = emitter.emit(formula.root());
			return finish(formula, fragment, emitter.requiredPackages());
		} catch (RuntimeException | StackOverflowError e) {
			return failed(formula, e);
		}
	}

	private FormulaResult failed(ParsedFormula formula, Throwable failure) {
		logger.warn("Formula {} failed to convert; falling back to its text", formula.index(), failure);
		formula.diagnostics().report(DiagnosticKind.INTERNAL_FAILURE,
				failure.getClass().getSimpleName() + ": " + failure.getMessage());
		String salvaged = FormulaTreeParser.textOf(formula.input().formula());
		return finish(formula, LatexEscaper.escapeMath(salvaged), new TreeSet<>());
	}

	private FormulaResult finish(ParsedFormula formula, String fragment, SortedSet<String> packages) {
		Diagnostics diagnostics = formula.diagnostics();
		String text = options.normalizeWhitespace() ? normalize(fragment) : fragment;
		if (text.isBlank()) {
			diagnostics.report(DiagnosticKind.EMPTY_FORMULA, "Formula produced no content");
			text = EMPTY_FRAGMENT;
		}
		if (!diagnostics.isEmpty()) {
			logger.warn("Formula {} degraded: {}", formula.index(), diagnostics.entries().stream()
					.map(d -> d.kind() + " (" + d.reason() + ")")
					.collect(Collectors.joining(", ")));
		}
		return new FormulaResult(formula.index(), text, formula.display(), diagnostics.entries(), packages);
	}

	static String normalize(String fragment) {
		return WHITESPACE.matcher(fragment).replaceAll(" ").strip();
	}

	private record ParsedFormula(
			int index,
			FormulaInput input,
			MathNode.Group root,
			Diagnostics diagnostics,
			Throwable failure
	) {
		boolean display() {
			return input.display();
		}
	}

	private static final class WorkerThreadFactory implements ThreadFactory {

		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable task) {
			Thread thread = new Thread(task, "mathtex-worker-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}
	}
}
