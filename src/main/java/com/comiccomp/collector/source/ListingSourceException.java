package com.comiccomp.collector.source;

import com.comiccomp.collector.model.Marketplace;
import lombok.Getter;

/**
 * Thrown by a {@link ListingSource} when a search call fails.
 * <p>
 * The HTTP status and the marketplace's own error code, when known, are carried
 * alongside the message so the error classifier can pattern-match all three.
 * </p>
 */
@Getter
public class ListingSourceException extends RuntimeException {

    private final Marketplace marketplace;

    /** HTTP status of the failed call; {@code null} when no response was received. */
    private final Integer statusCode;

    /** Marketplace- or transport-specific code, e.g. {@code "ECONNRESET"}. */
    private final String errorCode;

    public ListingSourceException(final Marketplace marketplace, final String message) {
        this(marketplace, null, null, message, null);
    }

    public ListingSourceException(final Marketplace marketplace, final int statusCode, final String message) {
        this(marketplace, statusCode, null, message, null);
    }

    public ListingSourceException(final Marketplace marketplace,
                                  final Integer statusCode,
                                  final String errorCode,
                                  final String message,
                                  final Throwable cause) {
        super(message, cause);
        this.marketplace = marketplace;
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }
}
