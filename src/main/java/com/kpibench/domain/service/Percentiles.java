package com.kpibench.domain.service;

/**
 * Continuous (linear interpolation) percentiles over a sorted sample,
 * the same definition as SQL PERCENTILE_CONT.
 */
public final class Percentiles {

    private Percentiles() {
    }

    /**
     * @param sorted   ascending, non-empty
     * @param fraction in [0, 1]
     */
    public static double continuous(double[] sorted, double fraction) {
        if (sorted.length == 0) {
            throw new IllegalArgumentException("Empty sample");
        }
        if (fraction < 0.0 || fraction > 1.0) {
            throw new IllegalArgumentException("Fraction out of range: " + fraction);
        }
        double rank = fraction * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }

    public static double mean(double[] values) {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }
}
