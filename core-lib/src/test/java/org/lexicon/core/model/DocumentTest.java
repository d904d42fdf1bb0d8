package org.lexicon.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentTest {

	@Test
	public void testNewDocumentIsEmpty() {
		Document doc = Document.of("doc1", "idx");

		assertEquals("doc1", doc.id());
		assertEquals("idx", doc.indexName());
		assertTrue(doc.fields().isEmpty());
		assertTrue(doc.props().isEmpty());
		assertTrue(doc.fieldTerms().isEmpty());
		assertTrue(doc.facets().isEmpty());
		assertFalse(doc.isAnalyzed());
	}

	@Test
	public void testAddFieldPrependsAndReturnsNewValue() {
		Document original = Document.of("doc1", "idx");
		Document withTitle = original.addField("title", "first");
		Document withBody = withTitle.addField("body", "second");

		assertTrue(original.fields().isEmpty());
		assertEquals(List.of(new FieldValue("title", "first")), withTitle.fields());
		assertEquals(List.of(new FieldValue("body", "second"), new FieldValue("title", "first")), withBody.fields());
	}

	@Test
	public void testAddPropPrepends() {
		Document doc = Document.of("doc1", "idx")
				.addProp("color", "red")
				.addProp("size", "xl");

		assertEquals("size", doc.props().get(0).name());
		assertEquals("color", doc.props().get(1).name());
	}

	@Test
	public void testDuplicateFieldNamesAreKept() {
		Document doc = Document.of("doc1", "idx")
				.addField("tag", "a")
				.addField("tag", "b");

		assertEquals(2, doc.fields().size());
	}

	@Test
	public void testClearKeepsIdentityAndDerivedData() {
		FieldTerms terms = new FieldTerms("title", List.of(new TermPositions("cat", List.of(1))));
		Document analyzed = Document.of("doc1", List.of(new FieldValue("title", "cat")),
						List.of(new FieldValue("p", "v")), "idx")
				.withAnalysis(List.of(terms), List.of(new FieldValue("genre", "fiction")));

		Document cleared = analyzed.clearFields().clearProps();

		assertEquals("doc1", cleared.id());
		assertEquals("idx", cleared.indexName());
		assertTrue(cleared.fields().isEmpty());
		assertTrue(cleared.props().isEmpty());
		assertEquals(List.of(terms), cleared.fieldTerms());
		assertEquals(1, cleared.facets().size());
		assertTrue(cleared.isAnalyzed());
	}

	@Test
	public void testFieldListsAreImmutable() {
		Document doc = Document.of("doc1", "idx").addField("title", "x");

		assertThrows(UnsupportedOperationException.class, () -> doc.fields().add(new FieldValue("y", "z")));
	}

	@Test
	public void testValueEquality() {
		Document a = Document.of("doc1", "idx").addField("title", "x");
		Document b = Document.of("doc1", "idx").addField("title", "x");

		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
		assertNotEquals(a, b.addProp("p", "v"));
	}
}
