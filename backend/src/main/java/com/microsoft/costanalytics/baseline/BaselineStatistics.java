package com.microsoft.costanalytics.baseline;

import com.microsoft.costanalytics.statistics.TimeSeriesStatistics;

/**
 * Descriptive statistics of a historical cost window.
 */
public record BaselineStatistics(
        double mean,
        double median,
        double min,
        double max,
        double stdDev,
        double variance,
        double q25,
        double q75,
        int count
) {

    public static BaselineStatistics of(double[] costs) {
        return new BaselineStatistics(
                TimeSeriesStatistics.mean(costs),
                TimeSeriesStatistics.median(costs),
                TimeSeriesStatistics.min(costs),
                TimeSeriesStatistics.max(costs),
                TimeSeriesStatistics.standardDeviation(costs),
                TimeSeriesStatistics.variance(costs),
                TimeSeriesStatistics.percentile(costs, 25),
                TimeSeriesStatistics.percentile(costs, 75),
                costs.length
        );
    }

    public static BaselineStatistics empty() {
        return new BaselineStatistics(0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    /**
     * Coefficient of variation (stdDev / mean), or the fallback when the mean is 0
     * or there are fewer than two points.
     */
    public double coefficientOfVariation(double fallback) {
        if (count < 2 || mean <= 0) {
            return fallback;
        }
        return stdDev / mean;
    }
}
