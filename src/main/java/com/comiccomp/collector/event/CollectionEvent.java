package com.comiccomp.collector.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One observability event, {@code {type, source, timestamp, payload}}.
 *
 * @param type      what happened
 * @param source    marketplace id the event concerns, or {@code null} for search-wide events
 * @param timestamp when it happened
 * @param payload   event-specific details; never {@code null}
 */
public record CollectionEvent(CollectionEventType type,
                              String source,
                              Instant timestamp,
                              Map<String, Object> payload) {

    public CollectionEvent {
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
