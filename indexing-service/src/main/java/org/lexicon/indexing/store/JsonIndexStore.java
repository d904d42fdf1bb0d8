package org.lexicon.indexing.store;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;
import org.lexicon.indexing.protocol.PartitionReply;
import org.lexicon.indexing.protocol.PostingFilter;
import org.lexicon.indexing.protocol.ReplySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.BiFunction;

/**
 * In-memory postings table of one partition, saved as JSON in the partition directory on close.
 */
public class JsonIndexStore implements IndexStore {
	private static final Logger logger = LoggerFactory.getLogger(JsonIndexStore.class);
	static final String POSTINGS_FILENAME = "postings.json";

	private static final Gson gson = new GsonBuilder()
			.setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
			.create();

	private final Path directory;
	private final int streamBatchSize;
	private final ConcurrentSkipListMap<TermKey, ConcurrentSkipListMap<PostingKey, IndexEntry>> terms;

	private JsonIndexStore(Path directory, int streamBatchSize) {
		this.directory = directory;
		this.streamBatchSize = Math.max(1, streamBatchSize);
		this.terms = new ConcurrentSkipListMap<>();
	}

	/**
	 * Open the store in a directory, creating it if needed and loading any saved postings
	 */
	public static JsonIndexStore open(Path directory, int streamBatchSize) throws StoreOpenException {
		JsonIndexStore store = new JsonIndexStore(directory, streamBatchSize);
		try {
			Files.createDirectories(directory);
			store.load();
		} catch (IOException | JsonParseException e) {
			throw new StoreOpenException("Failed to open index store at " + directory, e);
		}
		return store;
	}

	@Override
	public void index(String index, String field, String term, int subType, long subTerm,
			String value, Map<String, Object> props, long timestamp) {
		IndexEntry entry = new IndexEntry(index, field, term, subType, subTerm, value, props, timestamp);
		putEntry(entry);
	}

	@Override
	public void stream(String index, String field, String term, int subType, long startSubTerm, long endSubTerm,
			ReplySink sink, String correlationId, PostingFilter filter) {
		ConcurrentSkipListMap<PostingKey, IndexEntry> postings = terms.get(new TermKey(index, field, term));
		if (postings == null) {
			return;
		}

		int sent = 0;
		List<PartitionReply.StreamResult> batch = new ArrayList<>(streamBatchSize);
		for (IndexEntry entry : postings.values()) {
			if (entry.subType() != subType || entry.subTerm() < startSubTerm || entry.subTerm() > endSubTerm) {
				continue;
			}
			if (!filter.accept(entry.value(), entry.props())) {
				continue;
			}

			batch.add(new PartitionReply.StreamResult(entry.value(), entry.props()));
			if (batch.size() >= streamBatchSize) {
				if (isCancelled(sink)) {
					logger.debug("Stream {} cancelled after {} results", correlationId, sent);
					return;
				}
				sink.send(new PartitionReply.StreamBatch(batch, correlationId));
				sent += batch.size();
				batch = new ArrayList<>(streamBatchSize);
			}
		}

		if (!batch.isEmpty() && !isCancelled(sink)) {
			sink.send(new PartitionReply.StreamBatch(batch, correlationId));
			sent += batch.size();
		}
		logger.debug("Streamed {} results for {}/{}/{}", sent, index, field, term);
	}

	private static boolean isCancelled(ReplySink sink) {
		return !sink.isOpen() || Thread.currentThread().isInterrupted();
	}

	@Override
	public List<TermCount> info(String index, String field, String term) {
		ConcurrentSkipListMap<PostingKey, IndexEntry> postings = terms.get(new TermKey(index, field, term));
		return List.of(new TermCount(term, postings == null ? 0 : postings.size()));
	}

	@Override
	public List<TermCount> infoRange(String index, String field, String startTerm, String endTerm, int limit) {
		if (startTerm.compareTo(endTerm) > 0) {
			return List.of();
		}
		NavigableMap<TermKey, ConcurrentSkipListMap<PostingKey, IndexEntry>> range =
				terms.subMap(new TermKey(index, field, startTerm), true, new TermKey(index, field, endTerm), true);

		List<TermCount> counts = new ArrayList<>();
		for (Map.Entry<TermKey, ConcurrentSkipListMap<PostingKey, IndexEntry>> e : range.entrySet()) {
			if (limit > 0 && counts.size() >= limit) {
				break;
			}
			if (!e.getValue().isEmpty()) {
				counts.add(new TermCount(e.getKey().term(), e.getValue().size()));
			}
		}
		return counts;
	}

	@Override
	public boolean isEmpty() {
		return terms.values().stream().allMatch(Map::isEmpty);
	}

	@Override
	public <A> A fold(BiFunction<IndexEntry, A, A> fn, A initial) {
		A acc = initial;
		for (ConcurrentSkipListMap<PostingKey, IndexEntry> postings : terms.values()) {
			for (IndexEntry entry : postings.values()) {
				acc = fn.apply(entry, acc);
			}
		}
		return acc;
	}

	@Override
	public void drop() throws StoreException {
		terms.clear();
		try {
			Files.deleteIfExists(postingsFile());
		} catch (IOException e) {
			throw new StoreException("Failed to drop index store at " + directory, e);
		}
		logger.info("Dropped index store at {}", directory);
	}

	@Override
	public void close() throws StoreException {
		try {
			save();
		} catch (IOException e) {
			throw new StoreException("Failed to save index store at " + directory, e);
		}
	}

	/**
	 * Write all postings to disk, replacing the previous file atomically
	 */
	public void save() throws IOException {
		List<IndexEntry> entries = new ArrayList<>();
		terms.values().forEach(postings -> entries.addAll(postings.values()));

		Path tmp = directory.resolve(POSTINGS_FILENAME + ".tmp");
		Files.writeString(tmp, gson.toJson(entries));
		Files.move(tmp, postingsFile(), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

		logger.info("Saved {} postings to {}", entries.size(), postingsFile());
	}

	private void load() throws IOException {
		Path file = postingsFile();
		if (!Files.exists(file)) {
			logger.debug("No saved postings at {}", file);
			return;
		}

		Type type = new TypeToken<List<IndexEntry>>(){}.getType();
		List<IndexEntry> entries = gson.fromJson(Files.readString(file), type);
		if (entries != null) {
			entries.forEach(this::putEntry);
			logger.info("Loaded {} postings from {}", entries.size(), file);
		}
	}

	private void putEntry(IndexEntry entry) {
		terms.computeIfAbsent(new TermKey(entry.index(), entry.field(), entry.term()), k -> new ConcurrentSkipListMap<>())
				.merge(new PostingKey(entry.subType(), entry.subTerm(), entry.value()), entry,
						(existing, incoming) -> incoming.timestamp() >= existing.timestamp() ? incoming : existing);
	}

	private Path postingsFile() {
		return directory.resolve(POSTINGS_FILENAME);
	}

	private record TermKey(String index, String field, String term) implements Comparable<TermKey> {
		private static final Comparator<TermKey> ORDER = Comparator.comparing(TermKey::index)
				.thenComparing(TermKey::field)
				.thenComparing(TermKey::term);

		@Override
		public int compareTo(TermKey other) {
			return ORDER.compare(this, other);
		}
	}

	private record PostingKey(int subType, long subTerm, String value) implements Comparable<PostingKey> {
		private static final Comparator<PostingKey> ORDER = Comparator.comparingInt(PostingKey::subType)
				.thenComparingLong(PostingKey::subTerm)
				.thenComparing(PostingKey::value);

		@Override
		public int compareTo(PostingKey other) {
			return ORDER.compare(this, other);
		}
	}
}
