package com.anomaly.alerting.detection;

import java.util.Arrays;

/**
 * Descriptive statistics over a metric sample. Medians and quartiles pick a single element
 * of the sorted sample (index {@code floor(n * q)}) rather than interpolating.
 */
final class SeriesStatistics {

    private SeriesStatistics() {
    }

    static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /** Population (not sample) standard deviation around the given mean. */
    static double populationStdDev(double[] values, double mean) {
        double sumSq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / values.length);
    }

    static double[] sorted(double[] values) {
        double[] copy = Arrays.copyOf(values, values.length);
        Arrays.sort(copy);
        return copy;
    }

    /** Element at {@code floor(n * q)} of an already sorted sample. */
    static double quantile(double[] sorted, double q) {
        int index = (int) Math.floor(sorted.length * q);
        return sorted[Math.min(index, sorted.length - 1)];
    }

    static double median(double[] values) {
        return quantile(sorted(values), 0.5);
    }

    static double[] absoluteDeviations(double[] values, double center) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = Math.abs(values[i] - center);
        }
        return out;
    }

    /** Percent change of {@code observed} relative to {@code reference}; 0 when the reference is 0. */
    static double percentDeviation(double observed, double reference) {
        if (reference == 0.0) return 0.0;
        return (observed - reference) / reference * 100.0;
    }
}
