package com.comiccomp.collector.event;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget dispatcher of {@link CollectionEvent}s.
 * <p>
 * Each listener is invoked on the supplied {@link Executor}. A listener that throws
 * is logged and skipped; a saturated executor drops the event. Publishing never
 * blocks and never fails the caller.
 * </p>
 */
@Slf4j
public class CollectionEventPublisher {

    private final List<CollectionEventListener> listeners;

    private final Executor executor;

    private final Clock clock;

    public CollectionEventPublisher(final List<CollectionEventListener> listeners,
                                    final Executor executor,
                                    final Clock clock) {
        this.listeners = List.copyOf(listeners);
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Publishes an event stamped with the current time.
     *
     * @param type    event type
     * @param source  marketplace id, or {@code null} for search-wide events
     * @param payload event details
     */
    public void publish(final CollectionEventType type,
                        final String source,
                        final Map<String, Object> payload) {
        CollectionEvent event = new CollectionEvent(type, source, clock.instant(), payload);
        for (CollectionEventListener listener : listeners) {
            try {
                executor.execute(() -> deliver(listener, event));
            } catch (RejectedExecutionException ex) {
                log.debug("Dropped {} event for {}: dispatcher saturated", type, source);
            }
        }
    }

    private static void deliver(final CollectionEventListener listener, final CollectionEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException ex) {
            log.warn("Event listener {} failed on {}: {}",
                    listener.getClass().getSimpleName(), event.type(), ex.toString());
        }
    }
}
