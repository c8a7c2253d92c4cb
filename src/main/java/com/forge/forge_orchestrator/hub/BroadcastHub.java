package com.forge.forge_orchestrator.hub;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-process fan-out to every attached observer.
 * <p>
 * Attach and detach take the registry's write lock; broadcast only reads it, so it never
 * iterates a registry that is being changed. Each observer has its own bounded queue: when it
 * is full that observer's copy is dropped and the others are unaffected. With no observers a
 * broadcast is simply discarded; the durable status file covers consumers that missed it.
 */
@Slf4j
public class BroadcastHub implements Broadcaster {

    private final Map<String, HubSubscription> subscriptions = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final int queueCapacity;
    private final Executor deliveryExecutor;

    public BroadcastHub(int queueCapacity, Executor deliveryExecutor) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
        this.deliveryExecutor = deliveryExecutor;
    }

    public HubSubscription attach(HubObserver observer) {
        HubSubscription subscription = new HubSubscription(observer, queueCapacity, deliveryExecutor, this::detach);
        HubSubscription previous;
        lock.writeLock().lock();
        try {
            previous = subscriptions.put(observer.id(), subscription);
        } finally {
            lock.writeLock().unlock();
        }
        if (previous != null) {
            previous.close();
        }
        log.info("Observer {} attached ({} total)", observer.id(), observerCount());
        return subscription;
    }

    public void detach(HubSubscription subscription) {
        boolean removed;
        lock.writeLock().lock();
        try {
            removed = subscriptions.remove(subscription.getObserver().id(), subscription);
        } finally {
            lock.writeLock().unlock();
        }
        subscription.close();
        if (removed) {
            log.info("Observer {} detached", subscription.getObserver().id());
        }
    }

    @Override
    public void broadcast(byte[] payload) {
        List<HubSubscription> targets;
        lock.readLock().lock();
        try {
            if (subscriptions.isEmpty()) {
                log.debug("No observers attached; broadcast discarded");
                return;
            }
            targets = new ArrayList<>(subscriptions.values());
        } finally {
            lock.readLock().unlock();
        }
        for (HubSubscription subscription : targets) {
            subscription.offer(payload);
        }
    }

    public int observerCount() {
        lock.readLock().lock();
        try {
            return subscriptions.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
