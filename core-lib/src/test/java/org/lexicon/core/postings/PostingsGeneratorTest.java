package org.lexicon.core.postings;

import org.junit.jupiter.api.Test;
import org.lexicon.core.analysis.BuiltinAnalyzerProvider;
import org.lexicon.core.analysis.DocumentAnalyzer;
import org.lexicon.core.analysis.PositionOrder;
import org.lexicon.core.model.Document;
import org.lexicon.core.model.FieldTerms;
import org.lexicon.core.model.FieldValue;
import org.lexicon.core.model.Posting;
import org.lexicon.core.model.TermPositions;
import org.lexicon.core.schema.JsonSchemaRegistry;
import org.lexicon.core.schema.Schema;
import org.lexicon.core.schema.SchemaField;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PostingsGeneratorTest {

	private static DocumentAnalyzer whitespaceAnalyzer(PositionOrder order) {
		JsonSchemaRegistry registry = new JsonSchemaRegistry();
		registry.register(new Schema("idx", BuiltinAnalyzerProvider.WHITESPACE, List.of(), List.of(
				new SchemaField("genre", true, null, null),
				new SchemaField("author", true, null, null)
		)));
		return new DocumentAnalyzer(registry, new BuiltinAnalyzerProvider(), order);
	}

	@Test
	public void testTheCatSatProducesThreePostings() throws Exception {
		Document doc = Document.of("doc1", List.of(new FieldValue("title", "the cat sat")), List.of(), "idx");

		List<Posting> postings = PostingsGenerator.postings(whitespaceAnalyzer(PositionOrder.ASCENDING).analyze(doc));

		assertEquals(3, postings.size());
		assertEquals(List.of("the", "cat", "sat"), postings.stream().map(Posting::term).toList());
		for (Posting posting : postings) {
			assertEquals("idx", posting.indexName());
			assertEquals("title", posting.fieldName());
			assertEquals("doc1", posting.docId());
			assertEquals(1, posting.frequency());
		}
		assertEquals(List.of(2), postings.get(1).wordPositions());
	}

	@Test
	public void testFrequencyMatchesOccurrences() throws Exception {
		Document doc = Document.of("doc1", List.of(new FieldValue("body", "x y x z x y")), List.of(), "idx");

		for (PositionOrder order : PositionOrder.values()) {
			List<Posting> postings = PostingsGenerator.postings(whitespaceAnalyzer(order).analyze(doc));
			Map<String, Integer> expected = Map.of("x", 3, "y", 2, "z", 1);

			assertEquals(3, postings.size());
			for (Posting posting : postings) {
				int k = expected.get(posting.term());
				assertEquals(k, posting.frequency(), "freq of " + posting.term() + " with " + order);
				assertEquals(k, posting.wordPositions().size(), "positions of " + posting.term() + " with " + order);
			}
		}
	}

	@Test
	public void testFacetsCopiedVerbatimIntoEveryPosting() throws Exception {
		Document doc = Document.of("doc1", List.of(
				new FieldValue("title", "alice wonderland"),
				new FieldValue("genre", "Fantasy, Children's"),
				new FieldValue("author", "Lewis Carroll")
		), List.of(), "idx");

		List<Posting> postings = PostingsGenerator.postings(whitespaceAnalyzer(PositionOrder.ASCENDING).analyze(doc));

		assertEquals(2, postings.size());
		for (Posting posting : postings) {
			assertEquals("Fantasy, Children's", posting.properties().get("genre"));
			assertEquals("Lewis Carroll", posting.properties().get("author"));
			assertEquals(List.of("word_pos", "freq", "genre", "author"), List.copyOf(posting.properties().keySet()));
		}
		assertTrue(postings.stream().noneMatch(p -> p.fieldName().equals("genre")));
	}

	@Test
	public void testSameTermInTwoFieldsYieldsTwoPostings() throws Exception {
		Document doc = Document.of("doc1", List.of(
				new FieldValue("title", "cat"),
				new FieldValue("body", "cat")
		), List.of(), "idx");

		List<Posting> postings = PostingsGenerator.postings(whitespaceAnalyzer(PositionOrder.ASCENDING).analyze(doc));

		assertEquals(List.of("title", "body"), postings.stream().map(Posting::fieldName).toList());
	}

	@Test
	public void testUnanalyzedDocumentHasNoPostings() {
		Document doc = Document.of("doc1", List.of(new FieldValue("title", "cat")), List.of(), "idx");

		assertTrue(PostingsGenerator.postings(doc).isEmpty());
	}

	@Test
	public void testFacetCannotOverrideGeneratedProperties() {
		Document doc = Document.of("doc1", "idx").withAnalysis(
				List.of(new FieldTerms("title", List.of(new TermPositions("cat", List.of(1, 4))))),
				List.of(new FieldValue("freq", "99"), new FieldValue("color", "red"), new FieldValue("color", "blue")));

		Posting posting = PostingsGenerator.postings(doc).get(0);

		assertEquals(2, posting.frequency());
		assertEquals("red", posting.properties().get("color"));
	}

	@Test
	public void testFoldTermsVisitsEveryTerm() {
		Document doc = Document.of("doc1", "idx").withAnalysis(List.of(
				new FieldTerms("a", List.of(new TermPositions("x", List.of(1)), new TermPositions("y", List.of(2, 3)))),
				new FieldTerms("b", List.of(new TermPositions("x", List.of(1))))
		), List.of());

		int tokens = PostingsGenerator.foldTerms(doc, 0, (field, term, positions, acc) -> acc + positions.size());

		assertEquals(4, tokens);
	}

	@Test
	public void testWordPositionsRejectsNonIntegers() {
		Posting typed = new Posting("idx", "body", "x", "doc1", Map.of(Posting.WORD_POS, List.of(5, 3, 1), Posting.FREQ, 3));
		assertEquals(List.of(5, 3, 1), typed.wordPositions());

		Posting untyped = new Posting("idx", "body", "x", "doc1", Map.of(Posting.WORD_POS, List.of("one"), Posting.FREQ, 1));
		assertThrows(ClassCastException.class, untyped::wordPositions);
	}
}
