package com.comiccomp.collector.model;

import java.time.Instant;

/**
 * Bookkeeping attached to every validation outcome and to each normalized listing.
 *
 * @param marketplace      marketplace the listing was validated against
 * @param validationMillis wall time spent in the engine
 * @param validatedAt      when validation finished
 * @param validatorVersion version of the rule set that produced the result
 */
public record ValidationMetadata(Marketplace marketplace,
                                 long validationMillis,
                                 Instant validatedAt,
                                 String validatorVersion) {
}
