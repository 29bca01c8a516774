package com.analysiswatch.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for stream events.
 * <p>
 * Supports per-topic subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations. Subscribers are invoked on
 * the publishing thread, in subscription order.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-topic subscribers keyed by event type. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<AnalysisEvent>>> topicSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events of every topic. */
    private final CopyOnWriteArrayList<Consumer<AnalysisEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (topic-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(AnalysisEvent event) {
        log.debug("Publishing event: {} (tenant {})", event.eventType(), event.tenantId());

        List<Consumer<AnalysisEvent>> topicSubs = topicSubscribers.get(event.eventType());
        if (topicSubs != null) {
            for (Consumer<AnalysisEvent> subscriber : topicSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<AnalysisEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of a single topic.
     *
     * @param topic    the event type to subscribe to
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String topic, Consumer<AnalysisEvent> consumer) {
        topicSubscribers.computeIfAbsent(topic, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to topic {}", topic);
        return () -> {
            CopyOnWriteArrayList<Consumer<AnalysisEvent>> subs = topicSubscribers.get(topic);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to events of every topic (global subscription).
     *
     * @param consumer callback invoked for each event regardless of topic
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<AnalysisEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Number of subscribers currently registered for a topic.
     */
    public int subscriberCount(String topic) {
        List<Consumer<AnalysisEvent>> subs = topicSubscribers.get(topic);
        return subs == null ? 0 : subs.size();
    }

    private void deliverSafely(Consumer<AnalysisEvent> subscriber, AnalysisEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
