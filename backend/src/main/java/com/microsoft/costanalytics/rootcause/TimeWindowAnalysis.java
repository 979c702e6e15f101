package com.microsoft.costanalytics.rootcause;

import java.time.Instant;

/**
 * Cost behaviour in the window surrounding an anomaly.
 *
 * @param volatility standard deviation over mean; 0 with fewer than two points or a zero mean
 */
public record TimeWindowAnalysis(
        Instant windowStart,
        Instant windowEnd,
        int dataPoints,
        double min,
        double max,
        double mean,
        double median,
        double stdDev,
        double volatility,
        double slope,
        WindowTrend trend
) {

    public enum WindowTrend {
        INCREASING,
        DECREASING,
        STABLE,
        INSUFFICIENT_DATA
    }

    static TimeWindowAnalysis empty(Instant windowStart, Instant windowEnd) {
        return new TimeWindowAnalysis(windowStart, windowEnd, 0, 0, 0, 0, 0, 0, 0, 0, WindowTrend.INSUFFICIENT_DATA);
    }
}
