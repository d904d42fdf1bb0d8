package org.lexicon.indexing.partition;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lexicon.indexing.protocol.NodeId;
import org.lexicon.indexing.protocol.PartitionCommand;
import org.lexicon.indexing.protocol.PartitionId;
import org.lexicon.indexing.protocol.PartitionReply;
import org.lexicon.indexing.protocol.PostingFilter;
import org.lexicon.indexing.protocol.ReplySink;
import org.lexicon.indexing.store.IndexEntry;
import org.lexicon.indexing.store.JsonIndexStoreFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

public class PartitionBackendTest {

	private static final NodeId NODE = NodeId.of("node-a");
	private static final PartitionId PARTITION = PartitionId.of(3);

	@TempDir
	Path tempDir;

	private PartitionBackend backend;
	private List<PartitionReply> replies;
	private ReplySink sink;

	@BeforeEach
	public void setUp() throws Exception {
		// streams run inline so their replies are visible as soon as dispatch returns
		backend = PartitionBackend.start(PARTITION, NODE, new JsonIndexStoreFactory(tempDir, 10), Runnable::run);
		replies = new CopyOnWriteArrayList<>();
		sink = replies::add;
	}

	private PartitionCommand.Stream streamCommand(String term, PartitionId target, NodeId node) {
		return new PartitionCommand.Stream("books", "title", term, 0, Long.MIN_VALUE, Long.MAX_VALUE,
				sink, "s1", target, node, PostingFilter.ACCEPT_ALL);
	}

	@Test
	public void testInitStreamAnswersReady() throws Exception {
		backend.dispatch(new PartitionCommand.InitStream(sink, "cid-1"));

		assertEquals(List.of(new PartitionReply.StreamReady(PARTITION, NODE, "cid-1")), replies);
	}

	@Test
	public void testIndexForwardsEveryField() throws Exception {
		backend.dispatch(new PartitionCommand.Index("books", "title", "cat", 2, 7L, "doc1",
				Map.of("freq", 1), 1234L));

		List<IndexEntry> entries = backend.fold((entry, acc) -> {
			acc.add(entry);
			return acc;
		}, new ArrayList<IndexEntry>());

		assertEquals(List.of(new IndexEntry("books", "title", "cat", 2, 7L, "doc1", Map.of("freq", 1), 1234L)), entries);
		assertTrue(replies.isEmpty());
		assertFalse(backend.isEmpty());
	}

	@Test
	public void testStreamForThisPartition() throws Exception {
		backend.dispatch(new PartitionCommand.Index("books", "title", "cat", 0, 0L, "doc1", Map.of(), 1L));
		backend.dispatch(new PartitionCommand.Index("books", "title", "cat", 0, 0L, "doc2", Map.of(), 1L));

		backend.dispatch(streamCommand("cat", PARTITION, NODE));

		assertEquals(2, replies.size());
		PartitionReply.StreamBatch batch = assertInstanceOf(PartitionReply.StreamBatch.class, replies.get(0));
		assertEquals(List.of("doc1", "doc2"), batch.results().stream().map(PartitionReply.StreamResult::value).toList());
		assertEquals(new PartitionReply.StreamEnd(PARTITION, "s1"), replies.get(1));
		assertEquals(0, backend.activeStreams());
	}

	@Test
	public void testStreamOfUnknownTermStillEnds() throws Exception {
		backend.dispatch(streamCommand("nothing", PARTITION, NODE));

		assertEquals(List.of(new PartitionReply.StreamEnd(PARTITION, "s1")), replies);
	}

	@Test
	public void testStreamForAnotherTargetIsIgnored() throws Exception {
		backend.dispatch(new PartitionCommand.Index("books", "title", "cat", 0, 0L, "doc1", Map.of(), 1L));

		backend.dispatch(streamCommand("cat", PartitionId.of(4), NODE));
		backend.dispatch(streamCommand("cat", PARTITION, NodeId.of("node-b")));

		assertTrue(replies.isEmpty());
	}

	@Test
	public void testInfoAndInfoRange() throws Exception {
		backend.dispatch(new PartitionCommand.Index("books", "title", "cat", 0, 0L, "doc1", Map.of(), 1L));
		backend.dispatch(new PartitionCommand.Index("books", "title", "cat", 0, 0L, "doc2", Map.of(), 1L));
		backend.dispatch(new PartitionCommand.Index("books", "title", "dog", 0, 0L, "doc1", Map.of(), 1L));

		backend.dispatch(new PartitionCommand.Info("books", "title", "cat", sink, "i1"));
		backend.dispatch(new PartitionCommand.InfoRange("books", "title", "a", "z", 1, sink, "i2"));

		assertEquals(new PartitionReply.InfoResponse(List.of(new PartitionReply.TermInfo("cat", NODE, 2)), "i1"), replies.get(0));
		assertEquals(new PartitionReply.InfoResponse(List.of(new PartitionReply.TermInfo("cat", NODE, 2)), "i2"), replies.get(1));
	}

	@Test
	public void testObjectOperations() {
		assertTrue(backend.get("books", "doc1").isEmpty());
		assertThrows(NotSupportedException.class, () -> backend.delete("books", "doc1"));
		assertThrows(NotSupportedException.class, () -> backend.list());
		assertThrows(NotSupportedException.class, () -> backend.listBucket("books"));
	}

	@Test
	public void testDropEmptiesPartition() throws Exception {
		backend.dispatch(new PartitionCommand.Index("books", "title", "cat", 0, 0L, "doc1", Map.of(), 1L));
		backend.drop();
		assertTrue(backend.isEmpty());
	}

	@Test
	public void testDispatchAfterStop() throws Exception {
		backend.stop();
		assertThrows(IllegalStateException.class,
				() -> backend.dispatch(new PartitionCommand.InitStream(sink, "late")));
	}

	@Test
	public void testInvertedInfoRangeAnswersEmpty() throws Exception {
		backend.dispatch(new PartitionCommand.Index("books", "title", "cat", 0, 0L, "doc1", Map.of(), 1L));

		backend.dispatch(new PartitionCommand.InfoRange("books", "title", "z", "a", 0, sink, "r"));

		assertEquals(List.of(new PartitionReply.InfoResponse(List.of(), "r")), replies);
	}
}
