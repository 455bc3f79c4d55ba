package com.fleetdeck.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Delivers round and node progress to listeners on the publishing thread.
 * Node events are published from dispatch workers, so listeners must be
 * thread-safe. A listener that throws is logged and skipped; the others
 * still receive the event.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    public void publish(FleetEvent event) {
        log.trace("{} round={} node={}", event.type(), event.roundId(), event.nodeId());
        for (Listener listener : listeners) {
            listener.offer(event);
        }
    }

    /** Listens to the events of one round only. */
    public Subscription subscribe(String roundId, Consumer<FleetEvent> consumer) {
        return subscribe(event -> roundId.equals(event.roundId()), consumer);
    }

    /** Listens to every round. */
    public Subscription subscribeAll(Consumer<FleetEvent> consumer) {
        return subscribe(event -> true, consumer);
    }

    public Subscription subscribe(Predicate<FleetEvent> filter, Consumer<FleetEvent> consumer) {
        var listener = new Listener(filter, consumer);
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    /** Stops delivery when closed. Closing twice is harmless. */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    private record Listener(Predicate<FleetEvent> filter, Consumer<FleetEvent> consumer) {

        void offer(FleetEvent event) {
            try {
                if (filter.test(event)) {
                    consumer.accept(event);
                }
            } catch (RuntimeException e) {
                log.warn("Listener failed on {} for round {}: {}", event.type(), event.roundId(), e.getMessage(), e);
            }
        }
    }
}
