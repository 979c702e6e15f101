package com.microsoft.costanalytics.forecast;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Monthly spend projection with a confidence band and named scenarios.
 *
 * For every month i: {@code 0 <= lower[i] <= base[i] <= upper[i]}.
 */
public record Forecast(
        String budgetId,
        int months,
        List<Double> baseForecast,
        ConfidenceInterval confidenceIntervals,
        Scenarios scenarios,
        Assumptions assumptions,
        Instant generatedAt
) {

    public double totalBase() {
        return baseForecast.stream().mapToDouble(Double::doubleValue).sum();
    }

    public record ConfidenceInterval(
            List<Double> lowerBound,
            List<Double> upperBound,
            double confidenceLevel,
            double marginOfError
    ) {
    }

    public record Scenarios(
            List<Double> realistic,
            List<Double> optimistic,
            List<Double> pessimistic
    ) {
    }

    /**
     * Inputs the projection was built on.
     *
     * @param sourceModel baseline model type, {@code MONTHLY_TREND}, {@code HISTORICAL_MEAN}
     *                    or {@code PLACEHOLDER}
     * @param placeholder true when no usable history existed and a constant was projected
     */
    public record Assumptions(
            Double annualGrowthRate,
            List<InfrastructureChange> infrastructureChanges,
            Map<Integer, Double> seasonalFactors,
            boolean seasonalityApplied,
            String sourceModel,
            boolean placeholder
    ) {
    }
}
