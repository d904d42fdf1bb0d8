package org.lexicon.indexing.partition;

import org.lexicon.indexing.protocol.NodeId;
import org.lexicon.indexing.protocol.PartitionCommand;
import org.lexicon.indexing.protocol.PartitionId;
import org.lexicon.indexing.store.IndexStoreFactory;
import org.lexicon.indexing.store.StoreException;
import org.lexicon.indexing.store.StoreOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The partitions hosted by this node. Partitions are added by {@link #start} and removed by {@link #stop}.
 */
public class PartitionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(PartitionRegistry.class);

    private final NodeId node;
    private final IndexStoreFactory storeFactory;
    private final ExecutorService streamExecutor;
    private final ConcurrentSkipListMap<PartitionId, PartitionWorker> workers =
            new ConcurrentSkipListMap<>(Comparator.comparingInt(PartitionId::value));

    public PartitionRegistry(NodeId node, IndexStoreFactory storeFactory) {
        this.node = node;
        this.storeFactory = storeFactory;
        AtomicInteger streamThreads = new AtomicInteger();
        this.streamExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "partition-stream-" + streamThreads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public NodeId node() {
        return node;
    }

    public synchronized PartitionWorker start(PartitionId partition) throws StoreOpenException {
        if (workers.containsKey(partition)) {
            throw new IllegalStateException("Partition " + partition + " is already started");
        }
        PartitionBackend backend = PartitionBackend.start(partition, node, storeFactory, streamExecutor);
        PartitionWorker worker = new PartitionWorker(backend);
        workers.put(partition, worker);
        return worker;
    }

    public synchronized void stop(PartitionId partition) throws StoreException {
        PartitionWorker worker = workers.remove(partition);
        if (worker == null) {
            throw new IllegalStateException("Partition " + partition + " is not started");
        }
        worker.stop();
    }

    /**
     * Stops every partition and the stream executor; failures are logged and do not stop the others.
     */
    public synchronized void stopAll() {
        for (PartitionId partition : new ArrayList<>(workers.keySet())) {
            try {
                stop(partition);
            } catch (StoreException e) {
                logger.error("Failed to stop partition {}", partition, e);
            }
        }
        streamExecutor.shutdownNow();
    }

    public List<PartitionId> partitions() {
        return List.copyOf(workers.keySet());
    }

    public Optional<PartitionWorker> worker(PartitionId partition) {
        return Optional.ofNullable(workers.get(partition));
    }

    /**
     * Local partition responsible for the postings of a term.
     */
    public PartitionId route(String index, String field, String term) {
        List<PartitionId> partitions = partitions();
        if (partitions.isEmpty()) {
            throw new IllegalStateException("No partitions started on node " + node);
        }
        return partitions.get(Math.floorMod(Objects.hash(index, field, term), partitions.size()));
    }

    public CompletableFuture<Void> send(PartitionId partition, PartitionCommand command) {
        PartitionWorker worker = workers.get(partition);
        if (worker == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Partition " + partition + " is not hosted on node " + node));
        }
        return worker.submit(command);
    }

    /**
     * Delivers a command to every local partition.
     */
    public CompletableFuture<Void> broadcast(PartitionCommand command) {
        CompletableFuture<?>[] futures = workers.values().stream()
                .map(worker -> worker.submit(command))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(futures);
    }
}
