package com.comiccomp.collector.collection;

import com.comiccomp.collector.model.Marketplace;
import com.comiccomp.collector.resilience.CircuitSnapshot;
import com.comiccomp.collector.resilience.ErrorRecord;
import com.comiccomp.collector.resilience.ErrorSummary;
import com.comiccomp.collector.validation.ValidationStatistics;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the collection pipeline's health.
 *
 * @param sources      call totals per marketplace
 * @param circuits     breaker state per marketplace that has failed at least once
 * @param retryQueues  retries waiting per marketplace
 * @param errors       aggregate error counters
 * @param recentErrors latest error records, newest first
 * @param validation   validation totals
 */
public record CollectionStatus(Map<Marketplace, CollectionMetrics.SourceMetrics> sources,
                               Map<Marketplace, CircuitSnapshot> circuits,
                               Map<Marketplace, Integer> retryQueues,
                               ErrorSummary errors,
                               List<ErrorRecord> recentErrors,
                               ValidationStatistics.Snapshot validation) {
}
