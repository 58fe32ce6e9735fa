package org.javai.mathtex.symbol;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.yaml.snakeyaml.Yaml;

/**
 * Parser for symbol table YAML files.
 *
 * Each class section ({@code ordinary}, {@code operator}, {@code relation}, {@code delimiter},
 * {@code large_operator}) maps single glyphs to LaTeX tokens; {@code function_name} maps names
 * to tokens and {@code invisible} lists glyphs to drop. {@code packages} lists, per LaTeX
 * package, the tokens that need it.
 */
public class SymbolTableParser {

	private static final String LARGE_OPERATOR = "large_operator";
	private static final String INVISIBLE = "invisible";
	private static final String PACKAGES = "packages";

	private final Yaml yaml = new Yaml();

	public SymbolTable parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (SymbolTableException e) {
			throw e;
		} catch (Exception e) {
			throw new SymbolTableException("Failed to parse symbol table from path: " + path, e);
		}
	}

	public SymbolTable parse(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return buildTable(data);
		} catch (SymbolTableException e) {
			throw e;
		} catch (Exception e) {
			throw new SymbolTableException("Failed to parse symbol table from input stream", e);
		}
	}

	public SymbolTable parse(Reader reader) {
		try {
			Map<String, Object> data = yaml.load(reader);
			return buildTable(data);
		} catch (SymbolTableException e) {
			throw e;
		} catch (Exception e) {
			throw new SymbolTableException("Failed to parse symbol table from reader", e);
		}
	}

	public SymbolTable parseString(String yamlContent) {
		try {
			Map<String, Object> data = yaml.load(yamlContent);
			return buildTable(data);
		} catch (SymbolTableException e) {
			throw e;
		} catch (Exception e) {
			throw new SymbolTableException("Failed to parse symbol table from string", e);
		}
	}

	private SymbolTable buildTable(Map<String, Object> data) {
		if (data == null) {
			throw new SymbolTableException("Symbol table document is empty");
		}
		Map<String, Set<String>> packagesByToken = packagesByToken(data.get(PACKAGES));
		Set<String> emitted = new HashSet<>();
		SymbolTable.Builder builder = SymbolTable.builder();
		for (Map.Entry<String, Object> section : data.entrySet()) {
			String key = section.getKey();
			if ("symbols_version".equals(key) || PACKAGES.equals(key)) {
				continue;
			}
			if (INVISIBLE.equals(key)) {
				for (Object glyph : asList(key, section.getValue())) {
					String text = String.valueOf(glyph);
					builder.invisible(text.codePointAt(0));
				}
				continue;
			}
			if (LARGE_OPERATOR.equals(key)) {
				asMap(key, section.getValue()).forEach((glyph, token) -> {
					emitted.add(token);
					builder.glyph(glyph, new SymbolEntry(token, SymbolClass.OPERATOR, true,
							packagesByToken.get(token)));
				});
				continue;
			}
			SymbolClass symbolClass = SymbolClass.fromKey(key)
					.orElseThrow(() -> new SymbolTableException("Unknown symbol class section: " + key));
			asMap(key, section.getValue()).forEach((glyphOrName, token) -> {
				emitted.add(token);
				SymbolEntry entry = new SymbolEntry(token, symbolClass, false, packagesByToken.get(token));
				if (symbolClass == SymbolClass.FUNCTION_NAME) {
					builder.name(glyphOrName, entry);
				} else {
					builder.glyph(glyphOrName, entry);
				}
			});
		}
		for (String token : packagesByToken.keySet()) {
			if (!emitted.contains(token)) {
				throw new SymbolTableException("Section '" + PACKAGES + "' lists '" + token + "' but no symbol emits it");
			}
		}
		return builder.build();
	}

	/**
	 * Invert {@code packages: {amssymb: [tokens...]}} into token to package names.
	 */
	private Map<String, Set<String>> packagesByToken(Object section) {
		Map<String, Set<String>> result = new HashMap<>();
		if (section == null) {
			return result;
		}
		if (!(section instanceof Map<?, ?> map)) {
			throw new SymbolTableException("Section '" + PACKAGES + "' must be a mapping");
		}
		map.forEach((pkg, tokens) -> {
			for (Object token : asList(PACKAGES + "." + pkg, tokens)) {
				result.computeIfAbsent(String.valueOf(token), t -> new TreeSet<>()).add(String.valueOf(pkg));
			}
		});
		return result;
	}

	@SuppressWarnings("unchecked")
	private Map<String, String> asMap(String section, Object value) {
		if (!(value instanceof Map<?, ?> map)) {
			throw new SymbolTableException("Section '" + section + "' must be a mapping");
		}
		Map<String, String> result = new LinkedHashMap<>();
		((Map<Object, Object>) map).forEach((k, v) -> {
			if (v == null) {
				throw new SymbolTableException("Missing token for '" + k + "' in section '" + section + "'");
			}
			result.put(String.valueOf(k), String.valueOf(v));
		});
		return result;
	}

	private List<?> asList(String section, Object value) {
		if (!(value instanceof List<?> list)) {
			throw new SymbolTableException("Section '" + section + "' must be a list");
		}
		return list;
	}
}
