package org.javai.mathtex.convert;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link ConversionOptions} from YAML.
 *
 * <pre>
 * max_depth: 64
 * parallelism: 4
 * display_style: equation
 * normalize_whitespace: true
 * </pre>
 *
 * Missing keys take their defaults and unknown keys are ignored.
 */
public class ConversionOptionsLoader {

	private static final Logger logger = LoggerFactory.getLogger(ConversionOptionsLoader.class);

	public static final String DEFAULT_RESOURCE = "mathtex.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Load options from the classpath resource, or the defaults when it is absent.
	 */
	public ConversionOptions loadResource(String resourcePath, ClassLoader loader) {
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				logger.debug("No {} on classpath; using default options", resourcePath);
				return ConversionOptions.defaults();
			}
			return load(is);
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to read options resource: " + resourcePath, e);
		}
	}

	public ConversionOptions load(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return fromMap(yaml.load(reader));
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to read options file: " + path, e);
		}
	}

	public ConversionOptions load(InputStream inputStream) {
		return fromMap(yaml.load(inputStream));
	}

	public ConversionOptions loadString(String yamlContent) {
		return fromMap(yaml.load(yamlContent));
	}

	private ConversionOptions fromMap(Object document) {
		ConversionOptions defaults = ConversionOptions.defaults();
		if (document == null) {
			return defaults;
		}
		if (!(document instanceof Map<?, ?> data)) {
			throw new IllegalArgumentException("Options document must be a mapping");
		}
		ConversionOptions options = new ConversionOptions(
				intValue(data, "max_depth", defaults.maxDepth()),
				intValue(data, "parallelism", defaults.parallelism()),
				styleValue(data, "display_style", defaults.displayStyle()),
				booleanValue(data, "normalize_whitespace", defaults.normalizeWhitespace()));
		logger.debug("Loaded conversion options {}", options);
		return options;
	}

	private static int intValue(Map<?, ?> data, String key, int fallback) {
		Object value = data.get(key);
		if (value == null) {
			return fallback;
		}
		if (value instanceof Integer i) {
			return i;
		}
		throw new IllegalArgumentException("Option '" + key + "' must be an integer but was: " + value);
	}

	private static boolean booleanValue(Map<?, ?> data, String key, boolean fallback) {
		Object value = data.get(key);
		if (value == null) {
			return fallback;
		}
		if (value instanceof Boolean b) {
			return b;
		}
		throw new IllegalArgumentException("Option '" + key + "' must be true or false but was: " + value);
	}

	private static MathWrapStyle styleValue(Map<?, ?> data, String key, MathWrapStyle fallback) {
		Object value = data.get(key);
		return value == null ? fallback : MathWrapStyle.fromKey(String.valueOf(value));
	}
}
