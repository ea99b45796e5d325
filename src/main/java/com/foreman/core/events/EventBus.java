package com.foreman.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for scheduler events.
 * <p>
 * Subscribers register for a single run or for every run. A subscriber that throws
 * is logged and skipped; it never disturbs the scheduler or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ForemanEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<ForemanEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(ForemanEvent event) {
        log.debug("Publishing event: {} for run {}", event.eventType(), event.runId());

        List<Consumer<ForemanEvent>> runSubs = runSubscribers.get(event.runId());
        if (runSubs != null) {
            for (Consumer<ForemanEvent> subscriber : runSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<ForemanEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of one run.
     *
     * @return a handle that removes the subscription
     */
    public Subscription subscribe(String runId, Consumer<ForemanEvent> consumer) {
        runSubscribers.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to run {}", runId);
        return () -> {
            CopyOnWriteArrayList<Consumer<ForemanEvent>> subs = runSubscribers.get(runId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    runSubscribers.remove(runId, subs);
                }
            }
        };
    }

    /** Subscribe to events of every run. */
    public Subscription subscribeAll(Consumer<ForemanEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ForemanEvent> subscriber, ForemanEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
