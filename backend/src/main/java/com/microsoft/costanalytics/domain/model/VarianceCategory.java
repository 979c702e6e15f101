package com.microsoft.costanalytics.domain.model;

/**
 * Qualitative bucket for the magnitude of a spend variance.
 *
 * Buckets on the absolute variance percentage:
 * - SIGNIFICANT: 25% and above
 * - MODERATE: 10% to 25%
 * - MINOR: 5% to 10%
 * - MINIMAL: below 5%
 */
public enum VarianceCategory {
    MINIMAL(0.0, "excellent"),
    MINOR(5.0, "good"),
    MODERATE(10.0, "fair"),
    SIGNIFICANT(25.0, "poor");

    private final double lowerBoundPercent;
    private final String performanceRating;

    VarianceCategory(double lowerBoundPercent, String performanceRating) {
        this.lowerBoundPercent = lowerBoundPercent;
        this.performanceRating = performanceRating;
    }

    public double getLowerBoundPercent() {
        return lowerBoundPercent;
    }

    /**
     * Overall budget performance implied by this variance.
     */
    public String getPerformanceRating() {
        return performanceRating;
    }

    public static VarianceCategory fromPercentage(double variancePercentage) {
        double magnitude = Math.abs(variancePercentage);
        if (magnitude >= SIGNIFICANT.lowerBoundPercent) {
            return SIGNIFICANT;
        }
        if (magnitude >= MODERATE.lowerBoundPercent) {
            return MODERATE;
        }
        if (magnitude >= MINOR.lowerBoundPercent) {
            return MINOR;
        }
        return MINIMAL;
    }
}
