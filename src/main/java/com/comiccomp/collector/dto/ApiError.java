package com.comiccomp.collector.dto;

/**
 * Body of a rejected request.
 *
 * @param error   short error kind, e.g. {@code invalid_query}
 * @param message human-readable detail
 */
public record ApiError(String error, String message) {
}
