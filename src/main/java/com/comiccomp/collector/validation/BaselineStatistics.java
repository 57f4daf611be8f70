package com.comiccomp.collector.validation;

import com.comiccomp.collector.model.Marketplace;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Rolling sample windows per (marketplace, metric).
 * <p>
 * Each window has its own lock, so listings from different marketplaces or for
 * different metrics never contend. Baselines live in memory only.
 * </p>
 */
public class BaselineStatistics {

    private final ConcurrentMap<Key, RollingWindow> windows = new ConcurrentHashMap<>();

    private final int windowSize;

    public BaselineStatistics(final int windowSize) {
        this.windowSize = windowSize;
    }

    public void record(final Marketplace marketplace, final BaselineMetric metric, final double value) {
        windows.computeIfAbsent(new Key(marketplace, metric), k -> new RollingWindow(windowSize)).add(value);
    }

    /**
     * @return the window's statistics, or empty if nothing was recorded yet
     */
    public Optional<BaselineSnapshot> snapshot(final Marketplace marketplace, final BaselineMetric metric) {
        RollingWindow window = windows.get(new Key(marketplace, metric));
        return window == null ? Optional.empty() : Optional.of(window.snapshot());
    }

    public int sampleCount(final Marketplace marketplace, final BaselineMetric metric) {
        RollingWindow window = windows.get(new Key(marketplace, metric));
        return window == null ? 0 : window.size();
    }

    /**
     * @return sample counts keyed {@code marketplace:metric}
     */
    public Map<String, Integer> sampleCounts() {
        Map<String, Integer> counts = new TreeMap<>();
        windows.forEach((key, window) -> counts.put(key.marketplace().id() + ":" + key.metric().id(), window.size()));
        return counts;
    }

    private record Key(Marketplace marketplace, BaselineMetric metric) {
    }
}
