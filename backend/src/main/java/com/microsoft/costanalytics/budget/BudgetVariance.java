package com.microsoft.costanalytics.budget;

import com.microsoft.costanalytics.domain.model.BudgetStatus;
import com.microsoft.costanalytics.domain.model.VarianceCategory;

import java.time.Instant;
import java.util.List;

/**
 * Actual spend compared with the budget and, when available, the forecast.
 *
 * @param predictedSpend      sum of the forecast's base projection; null without a forecast
 * @param forecastVariancePct (actual - predicted) / predicted in percent; null without a forecast
 * @param forecastAccuracy    max(0, 100 - |forecastVariancePct|); null without a forecast
 * @param category            bucket of the forecast variance, or of actual vs budget without a forecast
 */
public record BudgetVariance(
        String budgetId,
        double actualSpend,
        double budgetAmount,
        Double predictedSpend,
        double actualVsBudgetPct,
        VarianceCategory category,
        Double forecastVariancePct,
        Double forecastAccuracy,
        double utilizationPct,
        BudgetStatus status,
        List<BudgetAlert> alerts,
        String overallPerformance,
        List<String> keyInsights,
        List<String> recommendations,
        List<String> actionItems,
        Instant generatedAt
) {
}
