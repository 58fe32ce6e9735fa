package org.javai.mathtex.symbol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SymbolTableTest {

	@Nested
	@DisplayName("Standard table")
	class StandardTable {

		private final SymbolTable table = SymbolTable.standard();

		@Test
		void isLoadedOnceAndShared() {
			assertThat(SymbolTable.standard()).isSameAs(table);
			assertThat(table.size()).isGreaterThan(200);
		}

		@Test
		void mapsGreekLettersAsOrdinary() {
			assertThat(table.lookup(SymbolId.codePoint('α')))
					.hasValueSatisfying(entry -> {
						assertThat(entry.token()).isEqualTo("\\alpha");
						assertThat(entry.symbolClass()).isEqualTo(SymbolClass.ORDINARY);
						assertThat(entry.controlWord()).isTrue();
					});
			assertThat(table.lookup('°')).map(SymbolEntry::controlWord).contains(false);
		}

		@Test
		void tokensOutsidePlainLatexCarryTheirPackage() {
			assertThat(table.lookup('∴')).map(SymbolEntry::packages).hasValueSatisfying(
					packages -> assertThat(packages).containsExactly("amssymb"));
			assertThat(table.lookup('∬')).map(SymbolEntry::packages).hasValueSatisfying(
					packages -> assertThat(packages).containsExactly("amsmath"));
			assertThat(table.functionName("sech")).map(SymbolEntry::packages).hasValueSatisfying(
					packages -> assertThat(packages).containsExactly("amsmath"));
			assertThat(table.lookup('α')).map(SymbolEntry::packages).hasValueSatisfying(
					packages -> assertThat(packages).isEmpty());
		}

		@Test
		void classifiesOperatorsAndRelations() {
			assertThat(table.lookup('×')).map(SymbolEntry::symbolClass).contains(SymbolClass.OPERATOR);
			assertThat(table.lookup('≤')).map(SymbolEntry::symbolClass).contains(SymbolClass.RELATION);
			assertThat(table.lookup('∈')).map(SymbolEntry::token).contains("\\in");
		}

		@Test
		void marksBigOperatorsAsLarge() {
			assertThat(table.lookup('∑')).hasValueSatisfying(entry -> {
				assertThat(entry.token()).isEqualTo("\\sum");
				assertThat(entry.largeOperator()).isTrue();
			});
			assertThat(table.lookup('∫')).map(SymbolEntry::largeOperator).contains(true);
		}

		@Test
		void delimitersMapToEscapedTokens() {
			assertThat(table.lookup('{')).map(SymbolEntry::token).contains("\\{");
			assertThat(table.lookup('⟨')).map(SymbolEntry::token).contains("\\langle");
			assertThat(table.lookup('(')).map(SymbolEntry::symbolClass).contains(SymbolClass.DELIMITER);
		}

		@Test
		void absentSymbolIsEmptyNotAnError() {
			assertThat(table.lookup('☃')).isEmpty();
			assertThat(table.lookup('x')).isEmpty();
			assertThat(table.lookup(SymbolId.named("nosuchname"))).isEmpty();
		}

		@Test
		void recognizesFunctionNames() {
			assertThat(table.functionName("sin")).map(SymbolEntry::token).contains("\\sin");
			assertThat(table.functionName(" lim ")).map(SymbolEntry::token).contains("\\lim");
			assertThat(table.functionName("Max")).map(SymbolEntry::token).contains("\\max");
			assertThat(table.functionName("sech")).map(SymbolEntry::token).contains("\\operatorname{sech}");
			assertThat(table.functionName("foo")).isEmpty();
			assertThat(table.functionName("")).isEmpty();
		}

		@Test
		void knowsInvisibleCharacters() {
			assertThat(table.isInvisible(0x200B)).isTrue();
			assertThat(table.isInvisible(0xFEFF)).isTrue();
			assertThat(table.isInvisible('x')).isFalse();
		}
	}

	@Nested
	@DisplayName("Parser")
	class Parser {

		private final SymbolTableParser parser = new SymbolTableParser();

		@Test
		void parsesSectionsIntoClasses() {
			SymbolTable table = parser.parseString("""
					symbols_version: 1
					ordinary:
					  "α": '\\alpha'
					relation:
					  "=": '='
					large_operator:
					  "∑": '\\sum'
					function_name:
					  sin: '\\sin'
					invisible:
					  - "\\u200B"
					""");

			assertThat(table.lookup('α')).map(SymbolEntry::token).contains("\\alpha");
			assertThat(table.lookup('=')).map(SymbolEntry::symbolClass).contains(SymbolClass.RELATION);
			assertThat(table.lookup('∑')).map(SymbolEntry::largeOperator).contains(true);
			assertThat(table.functionName("sin")).isPresent();
			assertThat(table.isInvisible(0x200B)).isTrue();
		}

		@Test
		void firstMappingForAGlyphWins() {
			SymbolTable table = parser.parseString("""
					ordinary:
					  "∥": '\\|'
					relation:
					  "∥": '\\parallel'
					""");

			assertThat(table.lookup('∥')).map(SymbolEntry::token).contains("\\|");
		}

		@Test
		void readsFromStream() {
			byte[] yaml = "operator:\n  \"×\": '\\times'\n".getBytes(StandardCharsets.UTF_8);

			SymbolTable table = parser.parse(new ByteArrayInputStream(yaml));

			assertThat(table.lookup('×')).map(SymbolEntry::token).contains("\\times");
		}

		@Test
		void attachesPackagesToEveryEntryEmittingTheToken() {
			SymbolTable table = parser.parseString("""
					relation:
					  "∴": '\\therefore'
					  "≤": '\\leq'
					large_operator:
					  "∬": '\\iint'
					packages:
					  amssymb:
					    - '\\therefore'
					  amsmath:
					    - '\\iint'
					""");

			assertThat(table.lookup('∴')).map(SymbolEntry::packages).hasValueSatisfying(
					packages -> assertThat(packages).containsExactly("amssymb"));
			assertThat(table.lookup('∬')).map(SymbolEntry::packages).hasValueSatisfying(
					packages -> assertThat(packages).containsExactly("amsmath"));
			assertThat(table.lookup('≤')).map(SymbolEntry::packages).hasValueSatisfying(
					packages -> assertThat(packages).isEmpty());
		}

		@Test
		void rejectsPackageForTokenNoSymbolEmits() {
			assertThatThrownBy(() -> parser.parseString("""
					ordinary:
					  "α": '\\alpha'
					packages:
					  amssymb:
					    - '\\beth'
					"""))
					.isInstanceOf(SymbolTableException.class)
					.hasMessageContaining("\\beth");
		}

		@Test
		void rejectsUnknownSection() {
			assertThatThrownBy(() -> parser.parseString("bogus:\n  \"x\": 'y'\n"))
					.isInstanceOf(SymbolTableException.class)
					.hasMessageContaining("bogus");
		}

		@Test
		void rejectsMultiCharacterGlyph() {
			assertThatThrownBy(() -> parser.parseString("ordinary:\n  \"ab\": 'x'\n"))
					.isInstanceOf(SymbolTableException.class);
		}

		@Test
		void rejectsEmptyDocument() {
			assertThatThrownBy(() -> parser.parseString(""))
					.isInstanceOf(SymbolTableException.class)
					.hasMessageContaining("empty");
		}

		@Test
		void missingResourceFailsLoudly() {
			assertThatThrownBy(() -> SymbolTable.fromResource("META-INF/missing.yml", getClass().getClassLoader()))
					.isInstanceOf(SymbolTableException.class)
					.hasMessageContaining("missing.yml");
		}
	}
}
