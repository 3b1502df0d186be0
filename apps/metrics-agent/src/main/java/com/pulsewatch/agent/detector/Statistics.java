package com.pulsewatch.agent.detector;

import java.util.Arrays;

final class Statistics {

    private Statistics() {
    }

    static double mean(double[] values, int from, int to) {
        if (to <= from) {
            return 0d;
        }
        double sum = 0d;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    static double mean(double[] values) {
        return mean(values, 0, values.length);
    }

    /** Sample standard deviation (n - 1 denominator); 0 for fewer than two values. */
    static double sampleStdDev(double[] values, double mean) {
        if (values.length < 2) {
            return 0d;
        }
        double squares = 0d;
        for (double value : values) {
            squares += Math.pow(value - mean, 2);
        }
        return Math.sqrt(squares / (values.length - 1));
    }

    static double[] sortedCopy(double[] values) {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        return sorted;
    }

    /** Linear-interpolated percentile over an ascending array. */
    static double percentile(double[] sortedValues, double percentile) {
        if (sortedValues.length == 0) {
            return 0d;
        }
        double index = percentile / 100.0 * (sortedValues.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sortedValues[lower];
        }
        double weight = index - lower;
        return sortedValues[lower] * (1 - weight) + sortedValues[upper] * weight;
    }

    /**
     * Least-squares fit of {@code values[from..to)} against the point index.
     */
    static Line fit(double[] values, int from, int to) {
        int n = to - from;
        if (n < 2) {
            return new Line(0d, n == 1 ? values[from] : 0d);
        }
        double meanX = (from + to - 1) / 2.0;
        double meanY = mean(values, from, to);
        double sxy = 0d;
        double sxx = 0d;
        for (int i = from; i < to; i++) {
            sxy += (i - meanX) * (values[i] - meanY);
            sxx += (i - meanX) * (i - meanX);
        }
        double slope = sxx == 0 ? 0d : sxy / sxx;
        return new Line(slope, meanY - slope * meanX);
    }

    record Line(double slope, double intercept) {
        double at(double x) {
            return intercept + slope * x;
        }
    }
}
