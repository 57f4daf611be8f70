package com.comiccomp.collector.resilience;

import java.time.Instant;
import java.util.Map;

/**
 * Recent error rate of all sources together.
 *
 * @param healthScore      one minus the error rate
 * @param errorRate        failures per recorded call within the error window
 * @param recentErrors     failures within the error window
 * @param recentOperations failures plus successes within the error window
 * @param healthy          whether the score is above the degradation threshold
 * @param errorsByHour     failures per hour bucket still retained, oldest first
 */
public record ErrorHealth(double healthScore,
                          double errorRate,
                          long recentErrors,
                          long recentOperations,
                          boolean healthy,
                          Map<Instant, Long> errorsByHour) {
}
