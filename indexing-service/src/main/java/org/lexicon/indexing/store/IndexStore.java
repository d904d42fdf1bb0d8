package org.lexicon.indexing.store;

import org.lexicon.indexing.protocol.PostingFilter;
import org.lexicon.indexing.protocol.ReplySink;

import java.io.Closeable;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Postings storage of a single partition, organised by (index, field, term).
 */
public interface IndexStore extends Closeable {
	/**
	 * Add or replace a posting; for the same key the newest timestamp wins
	 */
	void index(String index, String field, String term, int subType, long subTerm,
			String value, Map<String, Object> props, long timestamp) throws StoreException;

	/**
	 * Send the postings of a term, restricted to a sub-term range and a filter, to a sink
	 * as {@link org.lexicon.indexing.protocol.PartitionReply.StreamBatch} messages.
	 * Returns early if the sink closes or the calling thread is interrupted.
	 */
	void stream(String index, String field, String term, int subType, long startSubTerm, long endSubTerm,
			ReplySink sink, String correlationId, PostingFilter filter) throws StoreException;

	/**
	 * Posting count of one term
	 */
	List<TermCount> info(String index, String field, String term) throws StoreException;

	/**
	 * Posting counts of the terms in [startTerm, endTerm], in term order
	 * @param limit maximum number of terms returned, unbounded when not positive
	 */
	List<TermCount> infoRange(String index, String field, String startTerm, String endTerm, int limit) throws StoreException;

	boolean isEmpty();

	/**
	 * Fold over every posting held by the store
	 */
	<A> A fold(BiFunction<IndexEntry, A, A> fn, A initial);

	/**
	 * Delete every posting, in memory and on disk
	 */
	void drop() throws StoreException;

	@Override
	void close() throws StoreException;
}
