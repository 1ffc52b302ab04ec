package com.parallax.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for run progress events.
 * <p>
 * Supports per-run subscriptions and global subscriptions that receive all events.
 * Delivery happens on the supplied {@link Executor}, so a slow subscriber never holds up
 * the publishing dispatcher or merge thread.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-run subscribers keyed by runId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ParallaxEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all runs. */
    private final CopyOnWriteArrayList<Consumer<ParallaxEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    private final Executor deliveryExecutor;

    public EventBus(Executor deliveryExecutor) {
        this.deliveryExecutor = deliveryExecutor;
    }

    /** Bus that delivers on the publishing thread. */
    public static EventBus direct() {
        return new EventBus(Runnable::run);
    }

    /**
     * Publish an event to all matching subscribers (run-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(ParallaxEvent event) {
        log.debug("Publishing event: {} for run {}", event.eventType(), event.runId());

        List<Consumer<ParallaxEvent>> runSubs = event.runId() == null ? null : runSubscribers.get(event.runId());
        if (runSubs != null) {
            for (Consumer<ParallaxEvent> subscriber : runSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<ParallaxEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific run.
     *
     * @param runId    the run to subscribe to
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String runId, Consumer<ParallaxEvent> consumer) {
        runSubscribers.compute(runId, (k, subs) -> {
            var list = subs == null ? new CopyOnWriteArrayList<Consumer<ParallaxEvent>>() : subs;
            list.add(consumer);
            return list;
        });
        log.debug("Subscribed to run {}", runId);
        // the last unsubscribe drops the run's entry
        return () -> runSubscribers.computeIfPresent(runId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    /** Number of runs that currently have at least one subscriber. */
    int subscribedRunCount() {
        return runSubscribers.size();
    }

    /**
     * Subscribe to events from all runs.
     *
     * @param consumer callback invoked for each event regardless of run
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<ParallaxEvent> consumer) {
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

    private void deliverSafely(Consumer<ParallaxEvent> subscriber, ParallaxEvent event) {
        try {
            deliveryExecutor.execute(() -> {
                try {
                    subscriber.accept(event);
                } catch (Exception e) {
                    log.warn("Subscriber threw exception processing event {}: {}",
                            event.eventType(), e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Dropped event {} for run {}: delivery executor rejected it",
                    event.eventType(), event.runId());
        }
    }
}
