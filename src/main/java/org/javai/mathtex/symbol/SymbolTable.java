package org.javai.mathtex.symbol;

import java.io.InputStream;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable mapping from symbol identity to LaTeX token and classification.
 *
 * Absent entries are not errors: callers fall back to the raw character, escaped.
 * The standard table is loaded once from {@value #STANDARD_RESOURCE} and shared
 * read-only by every conversion in the process.
 */
public final class SymbolTable {

	private static final Logger logger = LoggerFactory.getLogger(SymbolTable.class);

	public static final String STANDARD_RESOURCE = "META-INF/mathtex-symbols.yml";

	private static volatile SymbolTable standardTable;

	private final Map<Integer, SymbolEntry> byCodePoint;
	private final Map<String, SymbolEntry> byName;
	private final Set<Integer> invisible;

	private SymbolTable(Map<Integer, SymbolEntry> byCodePoint, Map<String, SymbolEntry> byName, Set<Integer> invisible) {
		this.byCodePoint = Map.copyOf(byCodePoint);
		this.byName = Map.copyOf(byName);
		this.invisible = Set.copyOf(invisible);
	}

	/**
	 * The process-wide table loaded from the bundled resource.
	 *
	 * @throws SymbolTableException if the bundled resource is missing or malformed
	 */
	public static SymbolTable standard() {
		SymbolTable table = standardTable;
		if (table == null) {
			synchronized (SymbolTable.class) {
				table = standardTable;
				if (table == null) {
					table = fromResource(STANDARD_RESOURCE, SymbolTable.class.getClassLoader());
					standardTable = table;
				}
			}
		}
		return table;
	}

	/**
	 * Load a table from a classpath resource.
	 */
	public static SymbolTable fromResource(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new SymbolTableException("Resource not found: " + resourcePath);
			}
			SymbolTable table = new SymbolTableParser().parse(is);
			logger.debug("Loaded {} symbols from {}", table.size(), resourcePath);
			return table;
		} catch (SymbolTableException e) {
			throw e;
		} catch (Exception e) {
			throw new SymbolTableException("Failed to load symbol table from resource: " + resourcePath, e);
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	public Optional<SymbolEntry> lookup(SymbolId id) {
		Objects.requireNonNull(id, "id must not be null");
		if (id instanceof SymbolId.CodePoint cp) {
			return lookup(cp.value());
		}
		return lookupName(((SymbolId.Named) id).name());
	}

	public Optional<SymbolEntry> lookup(int codePoint) {
		return Optional.ofNullable(byCodePoint.get(codePoint));
	}

	public Optional<SymbolEntry> lookupName(String name) {
		return Optional.ofNullable(byName.get(name));
	}

	/**
	 * Match text against the recognized function names, exactly first and then case-insensitively.
	 */
	public Optional<SymbolEntry> functionName(String text) {
		if (text == null || text.isBlank()) {
			return Optional.empty();
		}
		String trimmed = text.strip();
		Optional<SymbolEntry> exact = lookupName(trimmed);
		if (exact.isPresent()) {
			return exact.filter(e -> e.symbolClass() == SymbolClass.FUNCTION_NAME);
		}
		return lookupName(trimmed.toLowerCase(Locale.ROOT))
				.filter(e -> e.symbolClass() == SymbolClass.FUNCTION_NAME);
	}

	public boolean isInvisible(int codePoint) {
		return invisible.contains(codePoint);
	}

	public int size() {
		return byCodePoint.size() + byName.size();
	}

	public static final class Builder {

		private final Map<Integer, SymbolEntry> byCodePoint = new HashMap<>();
		private final Map<String, SymbolEntry> byName = new HashMap<>();
		private final Set<Integer> invisible = new HashSet<>();

		private Builder() {
		}

		/**
		 * Map a single-code-point glyph. The first mapping for a glyph wins.
		 */
		public Builder glyph(String glyph, SymbolEntry entry) {
			Objects.requireNonNull(glyph, "glyph must not be null");
			Objects.requireNonNull(entry, "entry must not be null");
			if (glyph.codePointCount(0, glyph.length()) != 1) {
				throw new IllegalArgumentException("Glyph must be exactly one code point: '" + glyph + "'");
			}
			int codePoint = glyph.codePointAt(0);
			if (byCodePoint.putIfAbsent(codePoint, entry) != null) {
				logger.debug("Symbol {} already mapped; keeping first entry", SymbolId.codePoint(codePoint));
			}
			return this;
		}

		public Builder name(String name, SymbolEntry entry) {
			Objects.requireNonNull(entry, "entry must not be null");
			if (name == null || name.isBlank()) {
				throw new IllegalArgumentException("Symbol name must not be blank");
			}
			byName.putIfAbsent(name, entry);
			return this;
		}

		public Builder invisible(int codePoint) {
			invisible.add(codePoint);
			return this;
		}

		public SymbolTable build() {
			return new SymbolTable(byCodePoint, byName, invisible);
		}
	}
}
