package org.lexicon.indexing.protocol;

import java.util.List;
import java.util.Map;

/**
 * Messages a partition sends to a {@link ReplySink}. Each carries the correlation id of its command.
 */
public sealed interface PartitionReply {

    String correlationId();

    record StreamReady(PartitionId partition, NodeId node, String correlationId) implements PartitionReply {}

    record StreamBatch(List<StreamResult> results, String correlationId) implements PartitionReply {
        public StreamBatch {
            results = List.copyOf(results);
        }
    }

    /** Last message of a stream. */
    record StreamEnd(PartitionId partition, String correlationId) implements PartitionReply {}

    record InfoResponse(List<TermInfo> terms, String correlationId) implements PartitionReply {
        public InfoResponse {
            terms = List.copyOf(terms);
        }
    }

    record StreamResult(String value, Map<String, Object> props) {}

    record TermInfo(String term, NodeId node, long count) {}
}
