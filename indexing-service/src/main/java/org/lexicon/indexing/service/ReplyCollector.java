package org.lexicon.indexing.service;

import org.lexicon.indexing.protocol.PartitionReply;
import org.lexicon.indexing.protocol.ReplySink;
import org.lexicon.indexing.store.StoreException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Reply sink that gathers the replies to one correlation id until a known number of partitions
 * have finished answering.
 *
 * <p>{@code StreamReady}, {@code InfoResponse} and {@code StreamEnd} each finish one partition's answer;
 * {@code StreamBatch} replies are collected without counting. Closing the collector cancels streams
 * still feeding it.</p>
 */
public class ReplyCollector implements ReplySink {
    private final String correlationId;
    private final CountDownLatch remaining;
    private final List<PartitionReply> replies = Collections.synchronizedList(new ArrayList<>());
    private volatile boolean open = true;

    public ReplyCollector(String correlationId, int expectedPartitions) {
        this.correlationId = correlationId;
        this.remaining = new CountDownLatch(expectedPartitions);
    }

    public String correlationId() {
        return correlationId;
    }

    @Override
    public void send(PartitionReply reply) {
        if (!open || !correlationId.equals(reply.correlationId())) {
            return;
        }
        replies.add(reply);
        if (!(reply instanceof PartitionReply.StreamBatch)) {
            remaining.countDown();
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    public void close() {
        open = false;
    }

    /**
     * Waits for every expected partition; on timeout the collector is closed.
     */
    public void await(long timeoutMillis) throws StoreException {
        try {
            if (!remaining.await(timeoutMillis, TimeUnit.MILLISECONDS)) {
                close();
                throw new StoreException("Timed out after " + timeoutMillis + " ms waiting for "
                        + remaining.getCount() + " partition(s) to answer " + correlationId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new StoreException("Interrupted while waiting for replies to " + correlationId, e);
        }
    }

    public <T extends PartitionReply> List<T> replies(Class<T> type) {
        synchronized (replies) {
            return replies.stream().filter(type::isInstance).map(type::cast).toList();
        }
    }
}
