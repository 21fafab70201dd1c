package com.warehousebot.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

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

    private static WarehouseEvent event(String type, String runId, String taskId) {
        return new WarehouseEvent(type, runId, taskId, Map.of(), Instant.now());
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to run subscriber")
        void deliversEventToRunSubscriber() {
            List<WarehouseEvent> received = new ArrayList<>();
            eventBus.subscribe("RUN-1", received::add);

            var event = event("task.dispatched", "RUN-1", "TASK-0001");
            eventBus.publish(event);

            assertEquals(List.of(event), received);
        }

        @Test
        @DisplayName("does not deliver event to subscribers of a different run")
        void doesNotDeliverToDifferentRun() {
            List<WarehouseEvent> received = new ArrayList<>();
            eventBus.subscribe("RUN-2", received::add);

            eventBus.publish(event("task.dispatched", "RUN-1", "TASK-0001"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("delivers events in publish order")
        void deliversEventsInOrder() {
            List<WarehouseEvent> received = new ArrayList<>();
            eventBus.subscribe("RUN-1", received::add);

            eventBus.publish(event("run.started", "RUN-1", null));
            eventBus.publish(event("task.dispatched", "RUN-1", "TASK-0001"));
            eventBus.publish(event("task.completed", "RUN-1", "TASK-0001"));

            assertEquals(List.of("run.started", "task.dispatched", "task.completed"),
                    received.stream().map(WarehouseEvent::eventType).toList());
        }

        @Test
        @DisplayName("global subscriber receives events from every run")
        void globalSubscriberReceivesAllRuns() {
            List<WarehouseEvent> received = new ArrayList<>();
            List<WarehouseEvent> runReceived = new ArrayList<>();
            eventBus.subscribeAll(received::add);
            eventBus.subscribe("RUN-1", runReceived::add);

            eventBus.publish(event("run.started", "RUN-1", null));
            eventBus.publish(event("run.started", "RUN-2", null));

            assertEquals(2, received.size());
            assertEquals(1, runReceived.size());
        }
    }

    @Nested
    @DisplayName("event type filter")
    class TypeFilterTests {

        @Test
        @DisplayName("delivers only the listed event types of the run")
        void deliversListedTypes() {
            List<WarehouseEvent> received = new ArrayList<>();
            eventBus.subscribe("RUN-1", Set.of("task.canceled", "run.finished"), received::add);

            eventBus.publish(event("task.dispatched", "RUN-1", "TASK-0001"));
            eventBus.publish(event("task.canceled", "RUN-1", "TASK-0001"));
            eventBus.publish(event("task.canceled", "RUN-2", "TASK-0001"));
            eventBus.publish(event("run.finished", "RUN-1", null));

            assertEquals(List.of("task.canceled", "run.finished"),
                    received.stream().map(WarehouseEvent::eventType).toList());
        }

        @Test
        @DisplayName("an empty type set delivers everything")
        void emptySetDeliversAll() {
            List<WarehouseEvent> received = new ArrayList<>();
            eventBus.subscribe("RUN-1", Set.of(), received::add);

            eventBus.publish(event("run.started", "RUN-1", null));
            eventBus.publish(event("path.planned", "RUN-1", "TASK-0001"));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("subscribing the same consumer twice keeps both until each is unsubscribed")
        void sameConsumerTwice() {
            List<WarehouseEvent> received = new ArrayList<>();
            Consumer<WarehouseEvent> consumer = received::add;
            EventBus.Subscription first = eventBus.subscribe("RUN-1", consumer);
            eventBus.subscribe("RUN-1", consumer);

            first.unsubscribe();
            first.unsubscribe();
            eventBus.publish(event("run.started", "RUN-1", null));

            assertEquals(1, received.size());
            assertEquals(1, eventBus.subscriberCount("RUN-1"));
        }

        @Test
        @DisplayName("a run subscription needs a run id")
        void nullRunRejected() {
            assertThrows(IllegalArgumentException.class, () -> eventBus.subscribe(null, e -> {}));
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribing stops delivery of future events")
        void unsubscribeStopsDelivery() {
            List<WarehouseEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("RUN-1", received::add);

            eventBus.publish(event("task.dispatched", "RUN-1", "TASK-0001"));
            subscription.unsubscribe();
            eventBus.publish(event("task.completed", "RUN-1", "TASK-0001"));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("unsubscribing a global subscription stops delivery")
        void unsubscribeGlobalStopsDelivery() {
            List<WarehouseEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribeAll(received::add);

            subscription.unsubscribe();
            eventBus.publish(event("run.started", "RUN-1", null));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("unsubscribing removes the run's listeners one by one")
        void unsubscribeCountsDown() {
            EventBus.Subscription first = eventBus.subscribe("RUN-1", e -> {});
            EventBus.Subscription second = eventBus.subscribe("RUN-1", e -> {});
            assertEquals(2, eventBus.subscriberCount("RUN-1"));

            first.unsubscribe();
            assertEquals(1, eventBus.subscriberCount("RUN-1"));
            second.unsubscribe();
            second.unsubscribe();

            assertEquals(0, eventBus.subscriberCount("RUN-1"));
        }

        @Test
        @DisplayName("a run can be subscribed again after its listeners left")
        void resubscribeAfterDrop() {
            eventBus.subscribe("RUN-1", e -> {}).unsubscribe();

            List<WarehouseEvent> received = new ArrayList<>();
            eventBus.subscribe("RUN-1", received::add);
            eventBus.publish(event("run.started", "RUN-1", null));

            assertEquals(1, received.size());
        }
    }

    @Nested
    @DisplayName("edge cases")
    class EdgeCaseTests {

        @Test
        @DisplayName("publishing with no subscribers does not throw")
        void publishWithNoSubscribersDoesNotThrow() {
            assertDoesNotThrow(() -> eventBus.publish(event("run.started", "RUN-1", null)));
        }

        @Test
        @DisplayName("subscriber exception does not prevent delivery to other subscribers")
        void subscriberExceptionDoesNotPreventOthers() {
            List<WarehouseEvent> received = new ArrayList<>();
            eventBus.subscribe("RUN-1", e -> {
                throw new RuntimeException("boom");
            });
            eventBus.subscribe("RUN-1", received::add);

            eventBus.publish(event("task.dispatched", "RUN-1", "TASK-0001"));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("handles concurrent publishes safely")
        void handlesConcurrentPublishes() throws InterruptedException {
            CopyOnWriteArrayList<WarehouseEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribe("RUN-1", received::add);

            int threadCount = 8;
            int eventsPerThread = 100;
            CountDownLatch latch = new CountDownLatch(threadCount);
            for (int t = 0; t < threadCount; t++) {
                new Thread(() -> {
                    for (int i = 0; i < eventsPerThread; i++) {
                        eventBus.publish(event("path.planned", "RUN-1", null));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(10, TimeUnit.SECONDS));
            assertEquals(threadCount * eventsPerThread, received.size());
        }
    }
}
