package org.javai.mathtex.convert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConversionOptionsLoaderTest {

	private final ConversionOptionsLoader loader = new ConversionOptionsLoader();

	@Test
	void bundledResourceHoldsDefaults() {
		ConversionOptions options = loader.loadResource(ConversionOptionsLoader.DEFAULT_RESOURCE,
				getClass().getClassLoader());

		assertThat(options).isEqualTo(ConversionOptions.defaults());
	}

	@Test
	void missingResourceFallsBackToDefaults() {
		assertThat(loader.loadResource("no-such-options.yml", getClass().getClassLoader()))
				.isEqualTo(ConversionOptions.defaults());
	}

	@Test
	void readsEveryOption() {
		ConversionOptions options = loader.loadString("""
				max_depth: 32
				parallelism: 4
				display_style: equation
				normalize_whitespace: false
				""");

		assertThat(options).isEqualTo(new ConversionOptions(32, 4, MathWrapStyle.EQUATION, false));
	}

	@Test
	void missingKeysTakeDefaultsAndUnknownKeysAreIgnored() {
		ConversionOptions options = loader.loadString("parallelism: 2\ncolour: blue\n");

		assertThat(options.parallelism()).isEqualTo(2);
		assertThat(options.maxDepth()).isEqualTo(64);
		assertThat(options.displayStyle()).isEqualTo(MathWrapStyle.DISPLAY);
	}

	@Test
	void emptyDocumentGivesDefaults() {
		assertThat(loader.loadString("")).isEqualTo(ConversionOptions.defaults());
	}

	@Test
	void readsFromFile(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("mathtex.yml");
		Files.writeString(file, "max_depth: 10\n");

		assertThat(loader.load(file).maxDepth()).isEqualTo(10);
	}

	@Test
	void rejectsInvalidValues() {
		assertThatThrownBy(() -> loader.loadString("max_depth: deep\n"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("max_depth");
		assertThatThrownBy(() -> loader.loadString("parallelism: 0\n"))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> loader.loadString("display_style: sideways\n"))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> loader.loadString("display_style: inline\n"))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> loader.loadString("- a\n- b\n"))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void wrapStylesWrapFragments() {
		assertThat(MathWrapStyle.INLINE.wrap("x")).isEqualTo("$x$");
		assertThat(MathWrapStyle.DISPLAY.wrap("x")).isEqualTo("\\[x\\]");
		assertThat(MathWrapStyle.EQUATION.wrap("x")).isEqualTo("\\begin{equation}\nx\n\\end{equation}");
		assertThat(MathWrapStyle.fromKey("Display")).isEqualTo(MathWrapStyle.DISPLAY);
	}
}
