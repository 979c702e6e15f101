package com.microsoft.costanalytics.forecast;

import java.util.Map;

/**
 * Direction, strength and seasonality of a monthly cost history.
 *
 * @param seasonalFactors month-of-year (1-12) to mean cost of that month divided by
 *                        the overall mean; empty below twelve data points
 */
public record TrendAnalysis(
        TrendDirection direction,
        double slope,
        double rSquared,
        TrendConfidence confidence,
        Map<Integer, Double> seasonalFactors,
        int dataPoints
) {

    public enum TrendDirection {
        INCREASING,
        DECREASING,
        STABLE,
        INSUFFICIENT_DATA
    }

    public enum TrendConfidence {
        LOW,
        MEDIUM,
        HIGH
    }

    public TrendAnalysis {
        seasonalFactors = seasonalFactors == null ? Map.of() : Map.copyOf(seasonalFactors);
    }

    static TrendAnalysis insufficientData(int dataPoints) {
        return new TrendAnalysis(TrendDirection.INSUFFICIENT_DATA, 0.0, 0.0, TrendConfidence.LOW, Map.of(), dataPoints);
    }

    public boolean hasSeasonalFactors() {
        return !seasonalFactors.isEmpty();
    }

    /**
     * Seasonal factor for a calendar month; 1.0 when unknown.
     */
    public double seasonalFactor(int monthOfYear) {
        return seasonalFactors.getOrDefault(monthOfYear, 1.0);
    }
}
