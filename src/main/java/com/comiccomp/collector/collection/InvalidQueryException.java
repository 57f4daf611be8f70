package com.comiccomp.collector.collection;

/**
 * Thrown before any source is called when a search query is unusable.
 */
public class InvalidQueryException extends RuntimeException {

    public InvalidQueryException(final String message) {
        super(message);
    }
}
