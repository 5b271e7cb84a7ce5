package com.di.qualitygate.profile;

import java.util.Arrays;

/**
 * Descriptive statistics over primitive samples. Methods return {@code null} where the statistic
 * is undefined for the sample (too few values, zero variance) instead of NaN or an exception.
 * Inputs are never modified.
 */
public final class Statistics {

    private Statistics() {
    }

    public static Double mean(double[] values) {
        if (values.length == 0) {
            return null;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /** Sample standard deviation (n - 1 denominator); needs at least two values. */
    public static Double sampleStd(double[] values) {
        if (values.length < 2) {
            return null;
        }
        return Math.sqrt(sumSquaredDeviations(values) / (values.length - 1));
    }

    /** Population standard deviation (n denominator); needs at least one value. */
    public static Double populationStd(double[] values) {
        if (values.length == 0) {
            return null;
        }
        return Math.sqrt(sumSquaredDeviations(values) / values.length);
    }

    /**
     * Adjusted Fisher-Pearson skewness (G1). Needs three values and non-zero variance.
     */
    public static Double skewness(double[] values) {
        int n = values.length;
        if (n < 3) {
            return null;
        }
        double mean = mean(values);
        double m2 = 0;
        double m3 = 0;
        for (double v : values) {
            double d = v - mean;
            m2 += d * d;
            m3 += d * d * d;
        }
        m2 /= n;
        m3 /= n;
        if (m2 == 0) {
            return null;
        }
        double g1 = m3 / Math.pow(m2, 1.5);
        return Math.sqrt((double) n * (n - 1)) / (n - 2) * g1;
    }

    /**
     * Bias-corrected excess kurtosis (G2). Needs four values and non-zero variance.
     */
    public static Double excessKurtosis(double[] values) {
        int n = values.length;
        if (n < 4) {
            return null;
        }
        double mean = mean(values);
        double m2 = 0;
        double m4 = 0;
        for (double v : values) {
            double d2 = (v - mean) * (v - mean);
            m2 += d2;
            m4 += d2 * d2;
        }
        m2 /= n;
        m4 /= n;
        if (m2 == 0) {
            return null;
        }
        double g2 = m4 / (m2 * m2) - 3.0;
        return ((n + 1) * g2 + 6.0) * (n - 1) / ((double) (n - 2) * (n - 3));
    }

    public static Double median(double[] values) {
        return quantile(values, 0.5);
    }

    /**
     * Quantile with linear interpolation between closest ranks: position {@code q * (n - 1)} in the sorted sample.
     */
    public static Double quantile(double[] values, double q) {
        if (values.length == 0) {
            return null;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return quantileOfSorted(sorted, q);
    }

    public static double quantileOfSorted(double[] sorted, double q) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        double pos = q * (sorted.length - 1);
        int lower = (int) Math.floor(pos);
        int upper = (int) Math.ceil(pos);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (pos - lower) * (sorted[upper] - sorted[lower]);
    }

    public static Double min(double[] values) {
        return values.length == 0 ? null : Arrays.stream(values).min().getAsDouble();
    }

    public static Double max(double[] values) {
        return values.length == 0 ? null : Arrays.stream(values).max().getAsDouble();
    }

    private static double sumSquaredDeviations(double[] values) {
        double mean = mean(values);
        double sum = 0;
        for (double v : values) {
            sum += (v - mean) * (v - mean);
        }
        return sum;
    }
}
