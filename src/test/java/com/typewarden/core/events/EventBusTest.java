package com.typewarden.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static CampaignEvent event(String type) {
        return new CampaignEvent(type, "batch-0001", Map.of(), Instant.now());
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to type subscriber")
        void deliversEventToTypeSubscriber() {
            List<CampaignEvent> received = new ArrayList<>();
            eventBus.subscribe(CampaignEvent.BATCH_COMPLETED, received::add);

            var event = event(CampaignEvent.BATCH_COMPLETED);
            eventBus.publish(event);

            assertEquals(List.of(event), received);
        }

        @Test
        @DisplayName("does not deliver events of other types")
        void doesNotDeliverOtherTypes() {
            List<CampaignEvent> received = new ArrayList<>();
            eventBus.subscribe(CampaignEvent.BATCH_COMPLETED, received::add);

            eventBus.publish(event(CampaignEvent.ALERT_RAISED));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("publishing with no subscribers is a no-op")
        void noSubscribers() {
            assertDoesNotThrow(() -> eventBus.publish(event(CampaignEvent.DASHBOARD_UPDATED)));
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("stops delivery after unsubscribe")
        void stopsDeliveryAfterUnsubscribe() {
            List<CampaignEvent> received = new ArrayList<>();
            var subscription = eventBus.subscribe(CampaignEvent.ALERT_RAISED, received::add);

            eventBus.publish(event(CampaignEvent.ALERT_RAISED));
            subscription.unsubscribe();
            eventBus.publish(event(CampaignEvent.ALERT_RAISED));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("unsubscribing one callback keeps the others")
        void unsubscribeKeepsOthers() {
            List<CampaignEvent> first = new ArrayList<>();
            List<CampaignEvent> second = new ArrayList<>();
            var subscription = eventBus.subscribe(CampaignEvent.BATCH_COMPLETED, first::add);
            eventBus.subscribe(CampaignEvent.BATCH_COMPLETED, second::add);

            subscription.unsubscribe();
            eventBus.publish(event(CampaignEvent.BATCH_COMPLETED));

            assertTrue(first.isEmpty());
            assertEquals(1, second.size());
        }
    }

    @Nested
    @DisplayName("subscriber isolation")
    class IsolationTests {

        @Test
        @DisplayName("a throwing subscriber does not block the others")
        void throwingSubscriberIsSkipped() {
            List<CampaignEvent> received = new ArrayList<>();
            eventBus.subscribe(CampaignEvent.BATCH_COMPLETED, e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribe(CampaignEvent.BATCH_COMPLETED, received::add);

            assertDoesNotThrow(() -> eventBus.publish(event(CampaignEvent.BATCH_COMPLETED)));
            assertEquals(1, received.size());
        }
    }
}
