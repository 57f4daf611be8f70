package com.comiccomp.collector.collection;

/**
 * How one source's part of a search ended.
 */
public enum SourceStatus {
    SUCCESS,
    FAILED,
    SKIPPED_CIRCUIT_OPEN,
    CANCELLED
}
