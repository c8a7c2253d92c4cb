package com.forge.forge_orchestrator.hub;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * One attached observer plus its bounded outbound queue.
 * At most one drain task runs per subscription, so the observer sees messages in broadcast order.
 */
@Slf4j
public class HubSubscription {

    private final HubObserver observer;
    private final BlockingQueue<byte[]> queue;
    private final Executor executor;
    private final Consumer<HubSubscription> onFailure;
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean closed;

    HubSubscription(HubObserver observer, int capacity, Executor executor, Consumer<HubSubscription> onFailure) {
        this.observer = observer;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.executor = executor;
        this.onFailure = onFailure;
    }

    public HubObserver getObserver() {
        return observer;
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public boolean isClosed() {
        return closed;
    }

    /** Queues a copy for this observer; returns false when the message was dropped. */
    boolean offer(byte[] payload) {
        if (closed) return false;
        if (!queue.offer(payload)) {
            long total = dropped.incrementAndGet();
            log.warn("Hub queue full for observer {}; dropped message ({} dropped so far)", observer.id(), total);
            return false;
        }
        scheduleDrain();
        return true;
    }

    void close() {
        closed = true;
        queue.clear();
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) return;
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            int discarded = discardQueued();
            draining.set(false);
            log.warn("Hub delivery executor rejected drain for observer {}; dropped {} queued message(s): {}",
                    observer.id(), discarded, e.getMessage());
        }
    }

    private int discardQueued() {
        int discarded = 0;
        while (queue.poll() != null) {
            discarded++;
        }
        dropped.addAndGet(discarded);
        return discarded;
    }

    private void drain() {
        try {
            byte[] next;
            while (!closed && (next = queue.poll()) != null) {
                observer.deliver(next);
            }
        } catch (Exception e) {
            log.warn("Delivery to observer {} failed, detaching: {}", observer.id(), e.getMessage());
            onFailure.accept(this);
            return;
        } finally {
            draining.set(false);
        }
        // A message may have landed between the last poll and releasing the flag
        if (!closed && !queue.isEmpty()) {
            scheduleDrain();
        }
    }
}
