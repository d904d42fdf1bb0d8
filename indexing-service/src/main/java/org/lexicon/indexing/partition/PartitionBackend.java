package org.lexicon.indexing.partition;

import org.lexicon.indexing.protocol.NodeId;
import org.lexicon.indexing.protocol.PartitionCommand;
import org.lexicon.indexing.protocol.PartitionId;
import org.lexicon.indexing.protocol.PartitionReply;
import org.lexicon.indexing.store.IndexEntry;
import org.lexicon.indexing.store.IndexStore;
import org.lexicon.indexing.store.IndexStoreFactory;
import org.lexicon.indexing.store.StoreException;
import org.lexicon.indexing.store.StoreOpenException;
import org.lexicon.indexing.store.TermCount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.function.BiFunction;

/**
 * Routes the commands of one partition to its index store.
 *
 * <p>Owns the store handle of the partition from {@link #start} until {@link #stop}. Commands are
 * expected from a single thread (see {@link PartitionWorker}); streams run on a separate executor so
 * a long stream does not hold up the commands queued behind it.</p>
 */
public class PartitionBackend {
    private static final Logger logger = LoggerFactory.getLogger(PartitionBackend.class);

    private final PartitionId partition;
    private final NodeId node;
    private final IndexStore store;
    private final Executor streamExecutor;
    private final Set<Future<?>> runningStreams = ConcurrentHashMap.newKeySet();
    private volatile boolean stopped;

    private PartitionBackend(PartitionId partition, NodeId node, IndexStore store, Executor streamExecutor) {
        this.partition = partition;
        this.node = node;
        this.store = store;
        this.streamExecutor = streamExecutor;
    }

    /**
     * Opens the partition's store and returns an active backend.
     *
     * @throws StoreOpenException if the store cannot be opened or created
     */
    public static PartitionBackend start(PartitionId partition, NodeId node, IndexStoreFactory storeFactory,
                                         Executor streamExecutor) throws StoreOpenException {
        IndexStore store = storeFactory.open(partition);
        logger.info("Started partition {} on node {}", partition, node);
        return new PartitionBackend(partition, node, store, streamExecutor);
    }

    /**
     * Cancels running streams and releases the store. Must be called once.
     */
    public void stop() throws StoreException {
        stopped = true;
        runningStreams.forEach(stream -> stream.cancel(true));
        store.close();
        logger.info("Stopped partition {}", partition);
    }

    public PartitionId partition() {
        return partition;
    }

    public NodeId node() {
        return node;
    }

    public int activeStreams() {
        return runningStreams.size();
    }

    public void dispatch(PartitionCommand command) throws StoreException {
        if (stopped) {
            throw new IllegalStateException("Partition " + partition + " is stopped");
        }

        if (command instanceof PartitionCommand.Index index) {
            store.index(index.index(), index.field(), index.term(), index.subType(), index.subTerm(),
                    index.value(), index.props(), index.timestamp());
        } else if (command instanceof PartitionCommand.InitStream init) {
            init.replyTo().send(new PartitionReply.StreamReady(partition, node, init.correlationId()));
        } else if (command instanceof PartitionCommand.Stream stream) {
            handleStream(stream);
        } else if (command instanceof PartitionCommand.Info info) {
            List<TermCount> counts = store.info(info.index(), info.field(), info.term());
            List<PartitionReply.TermInfo> terms = counts.stream()
                    .map(c -> new PartitionReply.TermInfo(info.term(), node, c.count()))
                    .toList();
            info.replyTo().send(new PartitionReply.InfoResponse(terms, info.correlationId()));
        } else if (command instanceof PartitionCommand.InfoRange range) {
            List<TermCount> counts = store.infoRange(range.index(), range.field(),
                    range.startTerm(), range.endTerm(), range.maxResults());
            List<PartitionReply.TermInfo> terms = counts.stream()
                    .map(c -> new PartitionReply.TermInfo(c.term(), node, c.count()))
                    .toList();
            range.replyTo().send(new PartitionReply.InfoResponse(terms, range.correlationId()));
        } else {
            throw new UnsupportedCommandException(command);
        }
    }

    private void handleStream(PartitionCommand.Stream stream) {
        if (!partition.equals(stream.targetPartition()) || !node.equals(stream.targetNode())) {
            // addressed to another partition or node
            logger.debug("Partition {} ignoring stream {} for {}@{}",
                    partition, stream.correlationId(), stream.targetPartition(), stream.targetNode());
            return;
        }

        FutureTask<Void> task = new FutureTask<>(() -> runStream(stream), null) {
            @Override
            protected void done() {
                runningStreams.remove(this);
            }
        };
        runningStreams.add(task);
        streamExecutor.execute(task);
    }

    private void runStream(PartitionCommand.Stream stream) {
        try {
            store.stream(stream.index(), stream.field(), stream.term(), stream.subType(),
                    stream.startSubTerm(), stream.endSubTerm(), stream.replyTo(), stream.correlationId(), stream.filter());
        } catch (StoreException | RuntimeException e) {
            logger.error("Stream {} on partition {} failed", stream.correlationId(), partition, e);
        } finally {
            if (stream.replyTo().isOpen()) {
                stream.replyTo().send(new PartitionReply.StreamEnd(partition, stream.correlationId()));
            }
        }
    }

    /**
     * Postings are not addressable by key, so a key lookup never finds anything.
     */
    public Optional<String> get(String bucket, String key) {
        logger.debug("Key lookup {}/{} on partition {}: not found", bucket, key, partition);
        return Optional.empty();
    }

    public void delete(String bucket, String key) throws NotSupportedException {
        throw new NotSupportedException("delete");
    }

    public List<String> list() throws NotSupportedException {
        throw new NotSupportedException("list");
    }

    public List<String> listBucket(String bucket) throws NotSupportedException {
        throw new NotSupportedException("list_bucket");
    }

    public boolean isEmpty() {
        return store.isEmpty();
    }

    public <A> A fold(BiFunction<IndexEntry, A, A> fn, A initial) {
        return store.fold(fn, initial);
    }

    public void drop() throws StoreException {
        store.drop();
    }
}
