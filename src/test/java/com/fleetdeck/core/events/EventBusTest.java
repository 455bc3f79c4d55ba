package com.fleetdeck.core.events;

import com.fleetdeck.core.model.DispatchStatus;
import com.fleetdeck.core.model.RouteMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static FleetEvent completed(String roundId, String nodeId) {
        return FleetEvent.nodeCompleted(roundId, nodeId, DispatchStatus.SUCCESS, Duration.ofMillis(5));
    }

    @Nested
    @DisplayName("delivery")
    class Delivery {

        @Test
        @DisplayName("round listeners only see their own round")
        void roundScoped() {
            List<FleetEvent> received = new ArrayList<>();
            eventBus.subscribe("r-1", received::add);

            eventBus.publish(completed("r-1", "web-1"));
            eventBus.publish(completed("r-2", "web-2"));

            assertEquals(List.of("web-1"), received.stream().map(FleetEvent::nodeId).toList());
        }

        @Test
        @DisplayName("events arrive in publish order")
        void inOrder() {
            List<FleetEvent.Type> received = new ArrayList<>();
            eventBus.subscribeAll(e -> received.add(e.type()));

            eventBus.publish(FleetEvent.roundStarted("r-1", 1));
            eventBus.publish(FleetEvent.nodeStarted("r-1", "web-1", RouteMode.DIRECT));
            eventBus.publish(completed("r-1", "web-1"));
            eventBus.publish(FleetEvent.roundCompleted("r-1", 1, Duration.ofSeconds(1)));

            assertEquals(List.of(FleetEvent.Type.ROUND_STARTED, FleetEvent.Type.NODE_STARTED,
                    FleetEvent.Type.NODE_COMPLETED, FleetEvent.Type.ROUND_COMPLETED), received);
        }

        @Test
        @DisplayName("a filter narrows delivery to matching events")
        void filtered() {
            List<FleetEvent> received = new ArrayList<>();
            eventBus.subscribe(FleetEvent::isNodeEvent, received::add);

            eventBus.publish(FleetEvent.roundStarted("r-1", 2));
            eventBus.publish(completed("r-1", "web-1"));

            assertEquals(1, received.size());
            assertEquals(FleetEvent.Type.NODE_COMPLETED, received.get(0).type());
        }
    }

    @Test
    @DisplayName("closing a subscription stops delivery")
    void closeStopsDelivery() {
        List<FleetEvent> received = new ArrayList<>();
        try (EventBus.Subscription ignored = eventBus.subscribe("r-1", received::add)) {
            eventBus.publish(completed("r-1", "web-1"));
            assertEquals(1, eventBus.listenerCount());
        }

        eventBus.publish(completed("r-1", "web-2"));
        assertEquals(1, received.size());
        assertEquals(0, eventBus.listenerCount());
    }

    @Test
    @DisplayName("a failing listener does not stop the others")
    void failingListenerIsolated() {
        List<FleetEvent> received = new ArrayList<>();
        eventBus.subscribeAll(e -> {
            throw new IllegalStateException("boom");
        });
        eventBus.subscribeAll(received::add);

        assertDoesNotThrow(() -> eventBus.publish(completed("r-1", "web-1")));
        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("concurrent publishers lose no events")
    void concurrentPublishes() throws InterruptedException {
        var received = new CopyOnWriteArrayList<FleetEvent>();
        eventBus.subscribe("r-1", received::add);

        int threads = 8;
        int perThread = 50;
        var done = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            int id = t;
            new Thread(() -> {
                for (int i = 0; i < perThread; i++) {
                    eventBus.publish(completed("r-1", "n-" + id + "-" + i));
                }
                done.countDown();
            }).start();
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        assertEquals(threads * perThread, received.size());
    }
}
