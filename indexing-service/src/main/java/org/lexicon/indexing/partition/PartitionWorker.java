package org.lexicon.indexing.partition;

import org.lexicon.indexing.protocol.PartitionCommand;
import org.lexicon.indexing.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Single-threaded command queue in front of a {@link PartitionBackend}.
 *
 * <p>Commands are dispatched one at a time in the order they were submitted, which keeps the
 * partition's store handle owned by exactly one thread.</p>
 */
public class PartitionWorker {
    private static final Logger logger = LoggerFactory.getLogger(PartitionWorker.class);
    private static final long STOP_TIMEOUT_SECONDS = 30;

    private final PartitionBackend backend;
    private final ExecutorService executor;

    public PartitionWorker(PartitionBackend backend) {
        this.backend = backend;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "partition-" + backend.partition().value());
            thread.setDaemon(true);
            return thread;
        });
    }

    public PartitionBackend backend() {
        return backend;
    }

    /**
     * Queues a command; the returned future completes once the command has been dispatched.
     */
    public CompletableFuture<Void> submit(PartitionCommand command) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        try {
            executor.execute(() -> dispatch(command, result));
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new IllegalStateException("Partition " + backend.partition() + " is stopping", e));
        }
        return result;
    }

    private void dispatch(PartitionCommand command, CompletableFuture<Void> result) {
        try {
            backend.dispatch(command);
            result.complete(null);
        } catch (StoreException | RuntimeException e) {
            logger.warn("Partition {} failed to handle {}: {}",
                    backend.partition(), command.getClass().getSimpleName(), e.getMessage());
            result.completeExceptionally(e);
        }
    }

    /**
     * Drains queued commands, then stops the backend.
     */
    public void stop() throws StoreException {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Partition {} did not drain its queue in {}s", backend.partition(), STOP_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        backend.stop();
    }
}
