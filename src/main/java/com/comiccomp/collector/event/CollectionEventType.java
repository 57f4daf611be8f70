package com.comiccomp.collector.event;

/**
 * Kinds of structured events emitted by the collection pipeline.
 */
public enum CollectionEventType {
    SEARCH_STARTED,
    SEARCH_COMPLETED,
    SEARCH_FAILED,
    SOURCE_SUCCEEDED,
    SOURCE_FAILED,
    RETRY_SCHEDULED,
    CIRCUIT_OPENED,
    CIRCUIT_HALF_OPENED,
    CIRCUIT_CLOSED,
    VALIDATION_FAILED,
    ANOMALY_DETECTED,
    ALERT
}
