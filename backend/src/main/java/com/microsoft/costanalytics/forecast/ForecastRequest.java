package com.microsoft.costanalytics.forecast;

import lombok.Builder;

import java.util.List;

/**
 * Parameters of a forecast projection.
 *
 * @param budgetId              budget the forecast belongs to
 * @param months                horizon in months, at least 1
 * @param annualGrowthRate      expected annual growth as a fraction (0.15 = 15%), nullable
 * @param infrastructureChanges planned changes in monthly spend, nullable
 * @param confidenceLevel       nominal confidence level in (0, 1), recorded with the interval
 * @param applySeasonality      scale months by their seasonal factor when factors are known
 */
@Builder(toBuilder = true)
public record ForecastRequest(
        String budgetId,
        int months,
        Double annualGrowthRate,
        List<InfrastructureChange> infrastructureChanges,
        double confidenceLevel,
        boolean applySeasonality
) {

    public static final int DEFAULT_MONTHS = 6;
    public static final double DEFAULT_CONFIDENCE_LEVEL = 0.95;

    public ForecastRequest {
        if (months < 1) {
            throw new IllegalArgumentException("Forecast horizon must be at least one month: " + months);
        }
        if (!(confidenceLevel > 0 && confidenceLevel < 1)) {
            throw new IllegalArgumentException("Confidence level must lie in (0, 1): " + confidenceLevel);
        }
        if (annualGrowthRate != null && (annualGrowthRate.isNaN() || annualGrowthRate.isInfinite())) {
            throw new IllegalArgumentException("Annual growth rate must be finite: " + annualGrowthRate);
        }
        infrastructureChanges = infrastructureChanges == null ? List.of() : List.copyOf(infrastructureChanges);
    }

    public static ForecastRequest of(String budgetId, int months) {
        return new ForecastRequest(budgetId, months, null, List.of(), DEFAULT_CONFIDENCE_LEVEL, false);
    }

    public double growthRateOrZero() {
        return annualGrowthRate == null ? 0.0 : annualGrowthRate;
    }

    public static class ForecastRequestBuilder {
        private int months = DEFAULT_MONTHS;
        private double confidenceLevel = DEFAULT_CONFIDENCE_LEVEL;
    }
}
