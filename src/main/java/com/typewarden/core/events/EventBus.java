package com.typewarden.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous in-process bus keyed by {@link CampaignEvent#eventType()}.
 * <p>
 * Events are delivered on the publishing thread, so a batch result reaches the
 * outcome tracker before {@code applyReplacements} returns. A subscriber that
 * throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, List<Consumer<CampaignEvent>>> subscribers = new ConcurrentHashMap<>();

    public void publish(CampaignEvent event) {
        List<Consumer<CampaignEvent>> targets = subscribers.getOrDefault(event.eventType(), List.of());
        log.debug("Publishing {} from {} to {} subscriber(s)", event.eventType(), event.source(), targets.size());
        for (Consumer<CampaignEvent> subscriber : targets) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Registers a callback for one event type.
     *
     * @return a handle that removes the callback again
     */
    public Subscription subscribe(String eventType, Consumer<CampaignEvent> consumer) {
        subscribers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to {}", eventType);
        return () -> subscribers.computeIfPresent(eventType, (k, list) -> {
            list.remove(consumer);
            return list.isEmpty() ? null : list;
        });
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<CampaignEvent> subscriber, CampaignEvent event) {
        try {
            subscriber.accept(event);
        } catch (RuntimeException e) {
            log.warn("Subscriber failed on {} from {}: {}", event.eventType(), event.source(), e.getMessage(), e);
        }
    }
}
