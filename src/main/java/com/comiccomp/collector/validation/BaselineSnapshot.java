package com.comiccomp.collector.validation;

/**
 * Summary statistics of one rolling window at a point in time.
 * Quartiles are taken as the sorted sample at index {@code floor(n * q)}.
 *
 * @param count  samples in the window
 * @param mean   arithmetic mean
 * @param stdDev population standard deviation
 * @param q1     first quartile
 * @param median second quartile
 * @param q3     third quartile
 */
public record BaselineSnapshot(int count, double mean, double stdDev, double q1, double median, double q3) {
}
