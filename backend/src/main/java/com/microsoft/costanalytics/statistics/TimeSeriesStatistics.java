package com.microsoft.costanalytics.statistics;

import java.util.Arrays;
import java.util.List;

/**
 * Statistical primitives over numeric cost sequences.
 *
 * All functions are pure and never throw on empty input: aggregates of an
 * empty sequence are 0. Sample variance and standard deviation follow the
 * n-1 convention and are 0 for fewer than two values.
 */
public final class TimeSeriesStatistics {

    private TimeSeriesStatistics() {
    }

    public static double[] toArray(List<Double> values) {
        if (values == null) {
            return new double[0];
        }
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    public static double sum(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum;
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        return sum(values) / values.length;
    }

    public static double median(double[] values) {
        return percentile(values, 50);
    }

    public static double min(double[] values) {
        return values.length == 0 ? 0.0 : Arrays.stream(values).min().getAsDouble();
    }

    public static double max(double[] values) {
        return values.length == 0 ? 0.0 : Arrays.stream(values).max().getAsDouble();
    }

    /**
     * Sample variance (divides by n-1).
     */
    public static double variance(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        return sumOfSquaredDeviations(values) / (values.length - 1);
    }

    /**
     * Population variance (divides by n).
     */
    public static double populationVariance(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        return sumOfSquaredDeviations(values) / values.length;
    }

    public static double standardDeviation(double[] values) {
        return Math.sqrt(variance(values));
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param values     unsorted values
     * @param percentile percentile in [0, 100]
     */
    public static double percentile(double[] values, double percentile) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double p = Math.max(0, Math.min(100, percentile));
        double index = p / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted[lower];
        }
        double weight = index - lower;
        return sorted[lower] * (1 - weight) + sorted[upper] * weight;
    }

    /**
     * Trailing moving average. Each point averages itself and up to
     * {@code window - 1} preceding points.
     */
    public static double[] movingAverage(double[] values, int window) {
        if (window < 1) {
            throw new IllegalArgumentException("Moving average window must be positive: " + window);
        }
        double[] averages = new double[values.length];
        double runningSum = 0;
        for (int i = 0; i < values.length; i++) {
            runningSum += values[i];
            if (i >= window) {
                runningSum -= values[i - window];
            }
            averages[i] = runningSum / Math.min(i + 1, window);
        }
        return averages;
    }

    /**
     * Ordinary least squares regression of value against index (0..n-1).
     */
    public static LinearFit linearRegression(double[] values) {
        int n = values.length;
        if (n == 0) {
            return new LinearFit(0.0, 0.0, 0.0);
        }
        double xMean = (n - 1) / 2.0;
        double yMean = mean(values);

        double numerator = 0;
        double denominator = 0;
        for (int i = 0; i < n; i++) {
            numerator += (i - xMean) * (values[i] - yMean);
            denominator += (i - xMean) * (i - xMean);
        }
        double slope = denominator == 0 ? 0.0 : numerator / denominator;
        double intercept = yMean - slope * xMean;

        double ssTot = sumOfSquaredDeviations(values);
        double rSquared;
        if (ssTot == 0) {
            rSquared = 1.0;
        } else {
            double ssRes = 0;
            for (int i = 0; i < n; i++) {
                double residual = values[i] - (intercept + slope * i);
                ssRes += residual * residual;
            }
            rSquared = 1 - ssRes / ssTot;
        }
        return new LinearFit(slope, intercept, Math.max(0, Math.min(1, rSquared)));
    }

    /**
     * Pearson correlation coefficient; 0 when either sequence has no variance.
     */
    public static double correlation(double[] a, double[] b) {
        requireSameLength(a, b);
        if (a.length < 2) {
            return 0.0;
        }
        double aMean = mean(a);
        double bMean = mean(b);
        double numerator = 0;
        double aVar = 0;
        double bVar = 0;
        for (int i = 0; i < a.length; i++) {
            numerator += (a[i] - aMean) * (b[i] - bMean);
            aVar += (a[i] - aMean) * (a[i] - aMean);
            bVar += (b[i] - bMean) * (b[i] - bMean);
        }
        double denominator = Math.sqrt(aVar * bVar);
        return denominator == 0 ? 0.0 : numerator / denominator;
    }

    public static double meanAbsoluteError(double[] actual, double[] predicted) {
        requireSameLength(actual, predicted);
        if (actual.length == 0) {
            return 0.0;
        }
        double total = 0;
        for (int i = 0; i < actual.length; i++) {
            total += Math.abs(actual[i] - predicted[i]);
        }
        return total / actual.length;
    }

    /**
     * Ratio guarded against a zero denominator; 0 whenever the ratio is undefined.
     */
    public static double safeDivide(double numerator, double denominator) {
        if (denominator == 0 || Double.isNaN(denominator)) {
            return 0.0;
        }
        double ratio = numerator / denominator;
        return Double.isNaN(ratio) ? 0.0 : ratio;
    }

    /**
     * Bounds {@code value} to [min, max]; NaN maps to {@code min}.
     */
    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }

    private static double sumOfSquaredDeviations(double[] values) {
        double mean = mean(values);
        double total = 0;
        for (double v : values) {
            total += (v - mean) * (v - mean);
        }
        return total;
    }

    private static void requireSameLength(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Sequences must have equal length: " + a.length + " != " + b.length);
        }
    }

    /**
     * Result of a least squares fit; {@code predict(i)} evaluates the line at index i.
     */
    public record LinearFit(double slope, double intercept, double rSquared) {

        public double predict(double index) {
            return intercept + slope * index;
        }
    }
}
