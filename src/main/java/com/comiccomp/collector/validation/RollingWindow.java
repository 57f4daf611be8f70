package com.comiccomp.collector.validation;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Bounded window of the most recent samples; the oldest sample is dropped on overflow.
 */
final class RollingWindow {

    private final int capacity;

    private final Deque<Double> samples;

    RollingWindow(final int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Window capacity must be positive, was " + capacity);
        }
        this.capacity = capacity;
        this.samples = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    synchronized void add(final double value) {
        samples.addLast(value);
        while (samples.size() > capacity) {
            samples.removeFirst();
        }
    }

    synchronized int size() {
        return samples.size();
    }

    BaselineSnapshot snapshot() {
        double[] values;
        synchronized (this) {
            values = samples.stream().mapToDouble(Double::doubleValue).toArray();
        }
        int n = values.length;
        if (n == 0) {
            return new BaselineSnapshot(0, 0, 0, 0, 0, 0);
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        double mean = sum / n;
        double squares = 0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        Arrays.sort(values);
        return new BaselineSnapshot(n, mean, Math.sqrt(squares / n),
                values[(int) Math.floor(n * 0.25)],
                values[(int) Math.floor(n * 0.5)],
                values[(int) Math.floor(n * 0.75)]);
    }
}
