package org.lexicon.indexing.protocol;

import org.lexicon.core.model.Posting;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Commands accepted by a partition. Every command is immutable and consumed once.
 */
public sealed interface PartitionCommand {

    /** Store one posting. Property order is kept as given. */
    record Index(
            String index,
            String field,
            String term,
            int subType,
            long subTerm,
            String value,
            Map<String, Object> props,
            long timestamp
    ) implements PartitionCommand {
        public Index {
            props = Collections.unmodifiableMap(new LinkedHashMap<>(props));
        }

        /**
         * Index command for a generated posting, without sub-term and stamped with the current time.
         */
        public static Index of(Posting posting) {
            return new Index(posting.indexName(), posting.fieldName(), posting.term(), 0, 0L,
                    posting.docId(), posting.properties(), System.currentTimeMillis());
        }
    }

    /** Stream handshake: the partition answers with {@link PartitionReply.StreamReady}. */
    record InitStream(ReplySink replyTo, String correlationId) implements PartitionCommand {}

    /**
     * Stream the postings of one term. Only the partition whose identity matches
     * ({@code targetPartition}, {@code targetNode}) answers; every other one ignores the command.
     */
    record Stream(
            String index,
            String field,
            String term,
            int subType,
            long startSubTerm,
            long endSubTerm,
            ReplySink replyTo,
            String correlationId,
            PartitionId targetPartition,
            NodeId targetNode,
            PostingFilter filter
    ) implements PartitionCommand {}

    /** Posting count of one term. */
    record Info(String index, String field, String term, ReplySink replyTo, String correlationId)
            implements PartitionCommand {}

    /** Posting counts of the terms within {@code [startTerm, endTerm]}, at most {@code maxResults} of them. */
    record InfoRange(
            String index,
            String field,
            String startTerm,
            String endTerm,
            int maxResults,
            ReplySink replyTo,
            String correlationId
    ) implements PartitionCommand {}
}
