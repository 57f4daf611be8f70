package com.comiccomp.collector.event;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes every pipeline event to the application log. Alerts and circuit
 * openings go out at WARN, the rest at INFO or DEBUG.
 */
@Slf4j
public class LoggingEventListener implements CollectionEventListener {

    @Override
    public void onEvent(final CollectionEvent event) {
        switch (event.type()) {
            case ALERT, CIRCUIT_OPENED, SEARCH_FAILED ->
                    log.warn("[{}] source={} {}", event.type(), event.source(), event.payload());
            case VALIDATION_FAILED, RETRY_SCHEDULED ->
                    log.debug("[{}] source={} {}", event.type(), event.source(), event.payload());
            default ->
                    log.info("[{}] source={} {}", event.type(), event.source(), event.payload());
        }
    }
}
