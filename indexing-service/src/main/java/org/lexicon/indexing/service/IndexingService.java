package org.lexicon.indexing.service;

import org.lexicon.core.analysis.AnalysisException;
import org.lexicon.core.analysis.DocumentAnalyzer;
import org.lexicon.core.codec.DocumentCodec;
import org.lexicon.core.model.Document;
import org.lexicon.core.model.Posting;
import org.lexicon.core.postings.PostingsGenerator;
import org.lexicon.indexing.document.DocumentStore;
import org.lexicon.indexing.partition.PartitionRegistry;
import org.lexicon.indexing.partition.PartitionWorker;
import org.lexicon.indexing.protocol.PartitionCommand;
import org.lexicon.indexing.protocol.PartitionId;
import org.lexicon.indexing.protocol.PartitionReply;
import org.lexicon.indexing.protocol.PostingFilter;
import org.lexicon.indexing.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Indexes documents into the local partitions and answers term queries over them.
 */
public class IndexingService {
    private static final Logger logger = LoggerFactory.getLogger(IndexingService.class);

    private final DocumentAnalyzer analyzer;
    private final DocumentStore documentStore;
    private final PartitionRegistry partitions;
    private final long replyTimeoutMillis;

    public IndexingService(DocumentAnalyzer analyzer, DocumentStore documentStore,
                           PartitionRegistry partitions, long replyTimeoutMillis) {
        this.analyzer = analyzer;
        this.documentStore = documentStore;
        this.partitions = partitions;
        this.replyTimeoutMillis = replyTimeoutMillis;
    }

    /**
     * Analyzes a document, stores it and sends each of its postings to the partition owning the term.
     * Nothing is written when analysis fails.
     */
    public IndexResult indexDocument(Document document) throws AnalysisException, IOException {
        Document analyzed = analyzer.analyze(document);
        documentStore.store(analyzed);

        List<Posting> postings = PostingsGenerator.postings(analyzed);
        List<CompletableFuture<Void>> pending = new ArrayList<>(postings.size());
        for (Posting posting : postings) {
            PartitionId partition = partitions.route(posting.indexName(), posting.fieldName(), posting.term());
            pending.add(partitions.send(partition, PartitionCommand.Index.of(posting)));
        }
        await(CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])), "index " + document.id());

        logger.info("Indexed document {}/{} with {} postings", document.indexName(), document.id(), postings.size());
        return new IndexResult(document.indexName(), document.id(), postings.size());
    }

    public IndexResult indexJson(String json) throws AnalysisException, IOException {
        return indexDocument(DocumentCodec.decode(json));
    }

    public Document getDocument(String indexName, String id) throws StoreException {
        return documentStore.fetch(indexName, id);
    }

    public void deleteDocument(String indexName, String id) throws StoreException {
        documentStore.remove(indexName, id);
        logger.info("Deleted document {}/{}", indexName, id);
    }

    public List<PartitionReply.TermInfo> info(String index, String field, String term) throws StoreException {
        ReplyCollector collector = newCollector(partitions.partitions().size());
        await(partitions.broadcast(new PartitionCommand.Info(index, field, term, collector, collector.correlationId())), "info");
        collector.await(replyTimeoutMillis);
        return termInfos(collector);
    }

    public List<PartitionReply.TermInfo> infoRange(String index, String field, String startTerm, String endTerm,
                                                   int maxResults) throws StoreException {
        ReplyCollector collector = newCollector(partitions.partitions().size());
        await(partitions.broadcast(new PartitionCommand.InfoRange(index, field, startTerm, endTerm, maxResults,
                collector, collector.correlationId())), "info_range");
        collector.await(replyTimeoutMillis);

        List<PartitionReply.TermInfo> terms = new ArrayList<>(termInfos(collector));
        terms.sort(Comparator.comparing(PartitionReply.TermInfo::term));
        return maxResults > 0 && terms.size() > maxResults ? terms.subList(0, maxResults) : terms;
    }

    /**
     * Streams the postings of a term from every partition: a handshake first finds one responder per
     * partition, then each responder is sent a stream command addressed to it alone.
     */
    public List<PartitionReply.StreamResult> stream(String index, String field, String term, PostingFilter filter)
            throws StoreException {
        ReplyCollector handshake = newCollector(partitions.partitions().size());
        await(partitions.broadcast(new PartitionCommand.InitStream(handshake, handshake.correlationId())), "init_stream");
        handshake.await(replyTimeoutMillis);

        Map<PartitionId, PartitionReply.StreamReady> responders = new LinkedHashMap<>();
        for (PartitionReply.StreamReady ready : handshake.replies(PartitionReply.StreamReady.class)) {
            responders.putIfAbsent(ready.partition(), ready);
        }

        ReplyCollector results = newCollector(responders.size());
        for (PartitionReply.StreamReady ready : responders.values()) {
            PartitionCommand.Stream command = new PartitionCommand.Stream(index, field, term, 0, Long.MIN_VALUE, Long.MAX_VALUE,
                    results, results.correlationId(), ready.partition(), ready.node(), filter);
            await(partitions.broadcast(command), "stream");
        }
        results.await(replyTimeoutMillis);

        List<PartitionReply.StreamResult> found = new ArrayList<>();
        results.replies(PartitionReply.StreamBatch.class).forEach(batch -> found.addAll(batch.results()));
        logger.debug("Streamed {} postings for {}/{}/{} from {} partitions", found.size(), index, field, term, responders.size());
        return found;
    }

    public IndexStats getStats() {
        List<PartitionId> local = partitions.partitions();
        int empty = 0;
        for (PartitionId partition : local) {
            if (partitions.worker(partition).map(PartitionWorker::backend).map(b -> b.isEmpty()).orElse(true)) {
                empty++;
            }
        }
        return new IndexStats(partitions.node().name(), local.size(), empty);
    }

    private ReplyCollector newCollector(int expectedPartitions) {
        return new ReplyCollector(UUID.randomUUID().toString(), expectedPartitions);
    }

    private static List<PartitionReply.TermInfo> termInfos(ReplyCollector collector) {
        List<PartitionReply.TermInfo> terms = new ArrayList<>();
        collector.replies(PartitionReply.InfoResponse.class).forEach(response -> terms.addAll(response.terms()));
        return terms;
    }

    private void await(CompletableFuture<Void> future, String operation) throws StoreException {
        try {
            future.get(replyTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof StoreException storeException) {
                throw storeException;
            }
            throw new StoreException("Failed to " + operation + ": " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new StoreException("Timed out waiting for partitions to " + operation, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("Interrupted while waiting for partitions to " + operation, e);
        }
    }

    public record IndexResult(String index, String docId, int postings) {}

    public record IndexStats(String node, int partitions, int emptyPartitions) {}
}
