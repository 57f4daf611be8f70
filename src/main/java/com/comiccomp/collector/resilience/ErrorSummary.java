package com.comiccomp.collector.resilience;

import java.util.Map;

/**
 * Aggregate error counters since start-up.
 *
 * @param totalErrors       every recorded failure
 * @param criticalErrors    failures classified critical
 * @param consecutiveErrors failures since the last success on any source
 * @param recoveredErrors   successes that directly followed a failure on the same source
 * @param byCategory        failures per category id
 * @param bySource          failures per marketplace id
 */
public record ErrorSummary(long totalErrors,
                           long criticalErrors,
                           int consecutiveErrors,
                           long recoveredErrors,
                           Map<String, Long> byCategory,
                           Map<String, Long> bySource) {
}
