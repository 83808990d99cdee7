package com.stratum.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for pipeline events.
 * <p>
 * Supports per-file subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-file subscribers keyed by fileId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<StratumEvent>>> fileSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<StratumEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to the file's subscribers, then to global subscribers.
     * A subscriber that throws never affects the publisher.
     */
    public void publish(StratumEvent event) {
        log.trace("Publishing event: {} for file {}", event.eventType(), event.fileId());

        List<Consumer<StratumEvent>> fileSubs = fileSubscribers.get(event.fileId());
        if (fileSubs != null) {
            for (Consumer<StratumEvent> subscriber : fileSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<StratumEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    public void publishProgress(String fileId, Integer batchId, ProgressEvent progress) {
        publish(new StratumEvent("analysis.progress", fileId, batchId, progress.toPayload(),
                Instant.now()));
    }

    /**
     * Subscribe to events for a specific file.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String fileId, Consumer<StratumEvent> consumer) {
        fileSubscribers.computeIfAbsent(fileId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to file {}", fileId);
        return () -> {
            CopyOnWriteArrayList<Consumer<StratumEvent>> subs = fileSubscribers.get(fileId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<StratumEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<StratumEvent> subscriber, StratumEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
