package com.tessera.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for lifecycle notifications.
 * <p>
 * Subscribers either follow one scope (a command session or sandbox session) or
 * receive everything. A scope ends with {@link #publishFinal}, after which its
 * subscribers are dropped. A failing subscriber never affects the publisher or
 * other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<TesseraEvent>>> scopeSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<TesseraEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(TesseraEvent event) {
        log.debug("Publishing {} for {}", event.eventType(), event.scopeId());

        List<Consumer<TesseraEvent>> scoped = scopeSubscribers.get(event.scopeId());
        if (scoped != null) {
            for (Consumer<TesseraEvent> subscriber : scoped) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<TesseraEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Delivers the last event of a scope, for example {@code session.closed}, then
     * removes every subscriber of that scope. Global subscribers are kept.
     */
    public void publishFinal(TesseraEvent event) {
        publish(event);
        List<Consumer<TesseraEvent>> dropped = scopeSubscribers.remove(event.scopeId());
        if (dropped != null) {
            log.debug("Scope {} ended with {}; dropped {} subscriber(s)",
                    event.scopeId(), event.eventType(), dropped.size());
        }
    }

    public int subscriberCount(String scopeId) {
        List<Consumer<TesseraEvent>> scoped = scopeSubscribers.get(scopeId);
        return scoped == null ? 0 : scoped.size();
    }

    public Subscription subscribe(String scopeId, Consumer<TesseraEvent> consumer) {
        scopeSubscribers.computeIfAbsent(scopeId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<TesseraEvent>> subs = scopeSubscribers.get(scopeId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    scopeSubscribers.remove(scopeId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<TesseraEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<TesseraEvent> subscriber, TesseraEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber failed on {}: {}", event.eventType(), e.getMessage(), e);
        }
    }
}
