package com.microsoft.costanalytics.forecast;

/**
 * A planned change in monthly spend, applied from {@code startMonth}
 * (zero-based offset into the forecast horizon) onwards.
 */
public record InfrastructureChange(int startMonth, double monthlyCostImpact, String description) {

    public InfrastructureChange {
        if (startMonth < 0) {
            throw new IllegalArgumentException("Infrastructure change start month must not be negative: " + startMonth);
        }
        if (Double.isNaN(monthlyCostImpact) || Double.isInfinite(monthlyCostImpact)) {
            throw new IllegalArgumentException("Infrastructure change impact must be finite: " + monthlyCostImpact);
        }
    }
}
