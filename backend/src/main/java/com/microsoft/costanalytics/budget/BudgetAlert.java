package com.microsoft.costanalytics.budget;

import java.util.List;

/**
 * Alert for a crossed budget threshold.
 *
 * The id is {@code {budgetId}_{thresholdName}}, so repeated analyses of the
 * same budget produce the same ids and callers can deduplicate.
 */
public record BudgetAlert(
        String alertId,
        String budgetId,
        String thresholdName,
        double thresholdPercentage,
        double currentSpend,
        double budgetAmount,
        double utilizationPercentage,
        Severity severity,
        String message,
        List<String> recommendedActions
) {

    public enum Severity {
        LOW,
        MEDIUM,
        HIGH,
        CRITICAL;

        static Severity forThreshold(double fraction) {
            if (fraction >= 1.0) {
                return CRITICAL;
            }
            if (fraction >= 0.9) {
                return HIGH;
            }
            if (fraction >= 0.75) {
                return MEDIUM;
            }
            return LOW;
        }
    }
}
