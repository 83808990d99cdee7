package com.stratum.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

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

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to file subscriber")
        void deliversEventToFileSubscriber() {
            List<StratumEvent> received = new ArrayList<>();
            eventBus.subscribe("db/a.sql", received::add);

            var event = StratumEvent.of("file.started", "db/a.sql", Map.of());
            eventBus.publish(event);

            assertEquals(List.of(event), received);
        }

        @Test
        @DisplayName("does not deliver event to subscribers of a different file")
        void doesNotDeliverToDifferentFile() {
            List<StratumEvent> received = new ArrayList<>();
            eventBus.subscribe("db/b.sql", received::add);

            eventBus.publish(StratumEvent.of("file.started", "db/a.sql", Map.of()));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("global and file subscribers both receive the event")
        void globalAndFileBothReceive() {
            List<StratumEvent> global = new ArrayList<>();
            List<StratumEvent> perFile = new ArrayList<>();
            eventBus.subscribeAll(global::add);
            eventBus.subscribe("db/a.sql", perFile::add);

            eventBus.publish(StratumEvent.of("file.completed", "db/a.sql", Map.of()));

            assertEquals(1, global.size());
            assertEquals(1, perFile.size());
        }
    }

    @Nested
    @DisplayName("progress")
    class ProgressTests {

        @Test
        @DisplayName("progress events carry batch id and a payload that round-trips")
        void progressPayload() {
            List<StratumEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            var progress = new ProgressEvent(ProgressEvent.SEMANTIC, 3, 8, 120);
            eventBus.publishProgress("db/a.sql", 3, progress);

            StratumEvent event = received.get(0);
            assertEquals("analysis.progress", event.eventType());
            assertEquals(3, event.batchId());
            assertEquals(progress, ProgressEvent.fromPayload(event.payload()));
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribing stops delivery of future events")
        void unsubscribeStopsDelivery() {
            List<StratumEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("db/a.sql", received::add);

            eventBus.publish(StratumEvent.of("file.started", "db/a.sql", Map.of()));
            subscription.unsubscribe();
            eventBus.publish(StratumEvent.of("file.completed", "db/a.sql", Map.of()));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("unsubscribing global subscription stops delivery")
        void unsubscribeGlobalStopsDelivery() {
            List<StratumEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribeAll(received::add);

            subscription.unsubscribe();
            eventBus.publish(new StratumEvent("file.started", "db/a.sql", null, Map.of(), Instant.now()));

            assertTrue(received.isEmpty());
        }
    }

    @Nested
    @DisplayName("robustness")
    class RobustnessTests {

        @Test
        @DisplayName("handles concurrent publishes safely")
        void handlesConcurrentPublishes() throws InterruptedException {
            CopyOnWriteArrayList<StratumEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribe("db/a.sql", received::add);

            int threadCount = 8;
            int eventsPerThread = 100;
            CountDownLatch latch = new CountDownLatch(threadCount);
            for (int t = 0; t < threadCount; t++) {
                new Thread(() -> {
                    for (int i = 0; i < eventsPerThread; i++) {
                        eventBus.publishProgress("db/a.sql", i,
                                new ProgressEvent(ProgressEvent.SEMANTIC, i, eventsPerThread, i));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(10, TimeUnit.SECONDS));
            assertEquals(threadCount * eventsPerThread, received.size());
        }

        @Test
        @DisplayName("subscriber exception does not prevent delivery to other subscribers")
        void subscriberExceptionDoesNotPreventOthers() {
            List<StratumEvent> received = new ArrayList<>();
            eventBus.subscribe("db/a.sql", e -> {
                throw new RuntimeException("boom");
            });
            eventBus.subscribe("db/a.sql", received::add);

            eventBus.publish(StratumEvent.of("file.started", "db/a.sql", Map.of()));

            assertEquals(1, received.size());
        }
    }
}
