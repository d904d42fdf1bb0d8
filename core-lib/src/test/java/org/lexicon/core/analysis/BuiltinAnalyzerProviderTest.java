package org.lexicon.core.analysis;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BuiltinAnalyzerProviderTest {

	private final BuiltinAnalyzerProvider provider = new BuiltinAnalyzerProvider();

	@Test
	public void testWhitespacePreservesCase() throws Exception {
		try (TextAnalyzer analyzer = provider.open()) {
			assertEquals(List.of("The", "Cat", "sat."), analyzer.analyze("  The Cat\tsat. ", "whitespace", List.of()));
		}
	}

	@Test
	public void testStandardLowercasesAndStripsPunctuation() throws Exception {
		try (TextAnalyzer analyzer = provider.open()) {
			assertEquals(List.of("hello", "world", "it", "s", "me"),
					analyzer.analyze("Hello, World! It's me.", "standard", List.of()));
		}
	}

	@Test
	public void testStandardArguments() throws Exception {
		try (TextAnalyzer analyzer = provider.open()) {
			List<String> tokens = analyzer.analyze("The quick brown fox and a dog", "standard",
					List.of("min_length=3", "max_length=5", "stop_words=the|and"));
			assertEquals(List.of("quick", "brown", "fox", "dog"), tokens);
		}
	}

	@Test
	public void testKeywordFactories() throws Exception {
		try (TextAnalyzer analyzer = provider.open()) {
			assertEquals(List.of("New York"), analyzer.analyze("New York", "keyword", List.of()));
			assertEquals(List.of("new york"), analyzer.analyze("New York", "lowercase_keyword", List.of()));
			assertTrue(analyzer.analyze("", "keyword", List.of()).isEmpty());
		}
	}

	@Test
	public void testUnknownFactoryFails() {
		TextAnalyzer analyzer = provider.open();
		assertThrows(AnalyzerException.class, () -> analyzer.analyze("x", "snowball", List.of()));
	}

	@Test
	public void testMalformedArgumentFails() {
		TextAnalyzer analyzer = provider.open();
		assertThrows(AnalyzerException.class, () -> analyzer.analyze("x", "standard", List.of("min_length")));
		assertThrows(AnalyzerException.class, () -> analyzer.analyze("x", "standard", List.of("min_length=abc")));
	}

	@Test
	public void testClosedSessionRejectsWork() {
		TextAnalyzer analyzer = provider.open();
		analyzer.close();
		assertThrows(AnalyzerException.class, () -> analyzer.analyze("x", "whitespace", List.of()));
	}
}
