package com.microsoft.costanalytics.budget;

import com.microsoft.costanalytics.domain.model.BudgetStatus;
import com.microsoft.costanalytics.domain.model.VarianceCategory;
import com.microsoft.costanalytics.forecast.Forecast;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Compares actual spend against the budget and the forecast.
 *
 * VARIANCE:
 * - Forecast variance: (actual - sum of forecast) / sum of forecast
 * - Budget variance: (actual - budget) / budget
 * The category follows the forecast variance when a forecast is supplied.
 *
 * STATUS:
 * EXCEEDED at 100% utilization, CRITICAL at 90%, WARNING at 75%.
 *
 * ALERTS:
 * One per crossed threshold (50/75/90/100%), severity by the threshold level.
 *
 * Zero denominators produce 0 and a warning; they never throw.
 */
@Service
@Slf4j
public class BudgetVarianceEngine {

    public BudgetVariance analyze(Forecast forecast, double actualSpend, double budgetAmount, String budgetId) {
        requireAmount("Actual spend", actualSpend);
        requireAmount("Budget amount", budgetAmount);

        Double predicted = null;
        Double forecastVariancePct = null;
        Double forecastAccuracy = null;
        if (forecast != null) {
            predicted = forecast.totalBase();
            if (predicted == 0) {
                log.warn("Forecast for budget {} predicts no spend; forecast variance reported as 0", budgetId);
                forecastVariancePct = 0.0;
            } else {
                forecastVariancePct = (actualSpend - predicted) / predicted * 100;
            }
            forecastAccuracy = Math.max(0, 100 - Math.abs(forecastVariancePct));
        }

        double actualVsBudgetPct;
        double utilization;
        if (budgetAmount == 0) {
            log.warn("Budget {} has a zero amount; budget variance and utilization reported as 0", budgetId);
            actualVsBudgetPct = 0.0;
            utilization = 0.0;
        } else {
            actualVsBudgetPct = (actualSpend - budgetAmount) / budgetAmount * 100;
            utilization = actualSpend / budgetAmount;
        }

        VarianceCategory category = VarianceCategory.fromPercentage(
                forecastVariancePct != null ? forecastVariancePct : actualVsBudgetPct);
        BudgetStatus status = BudgetStatus.fromUtilization(utilization);
        List<BudgetAlert> alerts = generateAlerts(budgetId, actualSpend, budgetAmount, utilization);

        log.info("Budget {}: {} utilization, status {}, variance {} ({} alerts)",
                budgetId,
                String.format("%.1f%%", utilization * 100),
                status,
                category,
                alerts.size());

        return new BudgetVariance(
                budgetId,
                actualSpend,
                budgetAmount,
                predicted,
                actualVsBudgetPct,
                category,
                forecastVariancePct,
                forecastAccuracy,
                utilization * 100,
                status,
                List.copyOf(alerts),
                category.getPerformanceRating(),
                keyInsights(actualVsBudgetPct),
                recommendations(category),
                actionItems(category),
                Instant.now()
        );
    }

    List<BudgetAlert> generateAlerts(String budgetId, double actualSpend, double budgetAmount, double utilization) {
        List<BudgetAlert> alerts = new ArrayList<>();
        if (budgetAmount == 0) {
            return alerts;
        }
        for (BudgetThreshold threshold : BudgetThreshold.values()) {
            if (actualSpend < budgetAmount * threshold.getFraction()) {
                continue;
            }
            BudgetAlert.Severity severity = BudgetAlert.Severity.forThreshold(threshold.getFraction());
            alerts.add(new BudgetAlert(
                    budgetId + "_" + threshold.getThresholdName(),
                    budgetId,
                    threshold.getThresholdName(),
                    threshold.getFraction() * 100,
                    actualSpend,
                    budgetAmount,
                    utilization * 100,
                    severity,
                    String.format(Locale.ROOT,
                            "Budget %s has reached %s threshold. Current utilization: %.1f%% ($%,.2f of $%,.2f)",
                            budgetId, threshold.getThresholdName(), utilization * 100, actualSpend, budgetAmount),
                    recommendedActions(severity)
            ));
        }
        return alerts;
    }

    static List<String> recommendedActions(BudgetAlert.Severity severity) {
        return switch (severity) {
            case CRITICAL -> List.of(
                    "Immediate review of spending required",
                    "Consider emergency cost reduction measures",
                    "Escalate to budget owner for approval");
            case HIGH -> List.of(
                    "Review current spending patterns",
                    "Identify potential cost savings",
                    "Prepare budget adjustment request");
            case MEDIUM -> List.of(
                    "Monitor spending closely",
                    "Review upcoming expenses",
                    "Consider optimization opportunities");
            case LOW -> List.of("Continue monitoring budget utilization");
        };
    }

    static List<String> recommendations(VarianceCategory category) {
        return switch (category) {
            case SIGNIFICANT -> List.of(
                    "Conduct thorough budget review",
                    "Implement immediate cost controls",
                    "Revise forecasting models");
            case MODERATE -> List.of(
                    "Review spending patterns",
                    "Adjust budget allocations",
                    "Improve cost monitoring");
            default -> List.of("Continue current budget management practices");
        };
    }

    static List<String> actionItems(VarianceCategory category) {
        if (category == VarianceCategory.MODERATE || category == VarianceCategory.SIGNIFICANT) {
            return List.of(
                    "Schedule budget review meeting",
                    "Analyze top cost drivers",
                    "Implement cost optimization measures");
        }
        return List.of();
    }

    private static List<String> keyInsights(double actualVsBudgetPct) {
        return actualVsBudgetPct > 0
                ? List.of("Spending is above budget allocation")
                : List.of("Spending is within budget limits");
    }

    private static void requireAmount(String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be a finite number: " + value);
        }
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
    }
}
