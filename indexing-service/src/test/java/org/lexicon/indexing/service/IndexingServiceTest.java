package org.lexicon.indexing.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lexicon.core.analysis.AnalysisException;
import org.lexicon.core.analysis.BuiltinAnalyzerProvider;
import org.lexicon.core.analysis.DocumentAnalyzer;
import org.lexicon.core.analysis.PositionOrder;
import org.lexicon.core.model.Document;
import org.lexicon.core.schema.JsonSchemaRegistry;
import org.lexicon.core.schema.Schema;
import org.lexicon.core.schema.SchemaField;
import org.lexicon.core.schema.SchemaNotFoundException;
import org.lexicon.indexing.document.DocumentNotFoundException;
import org.lexicon.indexing.document.DocumentStore;
import org.lexicon.indexing.document.InMemoryObjectStore;
import org.lexicon.indexing.partition.PartitionRegistry;
import org.lexicon.indexing.protocol.NodeId;
import org.lexicon.indexing.protocol.PartitionId;
import org.lexicon.indexing.protocol.PartitionReply;
import org.lexicon.indexing.protocol.PostingFilter;
import org.lexicon.indexing.store.JsonIndexStoreFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class IndexingServiceTest {

	@TempDir
	Path tempDir;

	private InMemoryObjectStore objects;
	private PartitionRegistry partitions;
	private IndexingService service;

	@BeforeEach
	public void setUp() throws Exception {
		JsonSchemaRegistry schemas = new JsonSchemaRegistry();
		schemas.register(new Schema("books", BuiltinAnalyzerProvider.WHITESPACE, List.of(), List.of(
				new SchemaField("genre", true, null, null),
				new SchemaField("broken", false, "no_such_analyzer", null)
		)));

		objects = new InMemoryObjectStore();
		partitions = new PartitionRegistry(NodeId.of("node-a"), new JsonIndexStoreFactory(tempDir, 2));
		for (int i = 0; i < 4; i++) {
			partitions.start(PartitionId.of(i));
		}

		DocumentAnalyzer analyzer = new DocumentAnalyzer(schemas, new BuiltinAnalyzerProvider(), PositionOrder.ASCENDING);
		service = new IndexingService(analyzer, new DocumentStore(objects), partitions, 5000);
	}

	@AfterEach
	public void tearDown() {
		partitions.stopAll();
	}

	private static long totalCount(List<PartitionReply.TermInfo> infos) {
		return infos.stream().mapToLong(PartitionReply.TermInfo::count).sum();
	}

	@Test
	public void testIndexAndStream() throws Exception {
		Document doc = Document.of("doc1", "books")
				.addField("genre", "fiction")
				.addField("title", "the cat sat");

		IndexingService.IndexResult result = service.indexDocument(doc);

		assertEquals(new IndexingService.IndexResult("books", "doc1", 3), result);

		List<PartitionReply.StreamResult> found = service.stream("books", "title", "cat", PostingFilter.ACCEPT_ALL);
		assertEquals(1, found.size());
		PartitionReply.StreamResult posting = found.get(0);
		assertEquals("doc1", posting.value());
		assertEquals(List.of(2), posting.props().get("word_pos"));
		assertEquals(1, posting.props().get("freq"));
		assertEquals("fiction", posting.props().get("genre"));

		System.out.println("✅ Index and stream test passed!");
	}

	@Test
	public void testStreamAcrossDocumentsWithFilter() throws Exception {
		for (int i = 1; i <= 5; i++) {
			service.indexDocument(Document.of("doc" + i, "books").addField("title", "common word" + i));
		}

		assertEquals(5, service.stream("books", "title", "common", PostingFilter.ACCEPT_ALL).size());
		List<PartitionReply.StreamResult> filtered = service.stream("books", "title", "common",
				(docId, props) -> docId.equals("doc3"));
		assertEquals(1, filtered.size());
		assertEquals("doc3", filtered.get(0).value());
		assertTrue(service.stream("books", "title", "absent", PostingFilter.ACCEPT_ALL).isEmpty());
	}

	@Test
	public void testInfoAndInfoRange() throws Exception {
		service.indexDocument(Document.of("doc1", "books").addField("title", "apple banana"));
		service.indexDocument(Document.of("doc2", "books").addField("title", "banana cherry"));

		assertEquals(2, totalCount(service.info("books", "title", "banana")));
		assertEquals(0, totalCount(service.info("books", "title", "durian")));

		List<PartitionReply.TermInfo> range = service.infoRange("books", "title", "a", "c", 0);
		assertEquals(List.of("apple", "banana"), range.stream().map(PartitionReply.TermInfo::term).toList());
		assertEquals(List.of(1L, 2L), range.stream().map(PartitionReply.TermInfo::count).toList());
		assertTrue(range.stream().allMatch(t -> t.node().equals(NodeId.of("node-a"))));

		assertEquals(1, service.infoRange("books", "title", "a", "z", 1).size());
	}

	@Test
	public void testDocumentIsStored() throws Exception {
		service.indexJson("{\"id\": \"doc1\", \"index\": \"books\", \"fields\": {\"title\": \"hello\"}, \"props\": {\"source\": \"feed\"}}");

		Document stored = service.getDocument("books", "doc1");
		assertEquals("hello", stored.fields().get(0).value());
		assertEquals("feed", stored.props().get(0).value());

		service.deleteDocument("books", "doc1");
		assertThrows(DocumentNotFoundException.class, () -> service.getDocument("books", "doc1"));
	}

	@Test
	public void testAnalysisFailureWritesNothing() {
		assertThrows(SchemaNotFoundException.class,
				() -> service.indexDocument(Document.of("doc1", "unknown").addField("title", "x")));
		assertThrows(AnalysisException.class,
				() -> service.indexDocument(Document.of("doc2", "books").addField("broken", "y").addField("title", "z")));

		assertEquals(0, objects.size());
		assertEquals(new IndexingService.IndexStats("node-a", 4, 4), service.getStats());
	}

	@Test
	public void testStats() throws Exception {
		service.indexDocument(Document.of("doc1", "books").addField("title", "one"));

		IndexingService.IndexStats stats = service.getStats();
		assertEquals("node-a", stats.node());
		assertEquals(4, stats.partitions());
		assertEquals(3, stats.emptyPartitions());
	}

	@Test
	public void testReindexReplacesPostingProps() throws Exception {
		service.indexDocument(Document.of("doc1", "books").addField("title", "cat").addField("genre", "fiction"));
		service.indexDocument(Document.of("doc1", "books").addField("title", "cat").addField("genre", "poetry"));

		List<PartitionReply.StreamResult> found = service.stream("books", "title", "cat", PostingFilter.ACCEPT_ALL);
		assertEquals(1, found.size());
		Map<String, Object> props = found.get(0).props();
		assertEquals("poetry", props.get("genre"));
	}
}
