package com.microsoft.costanalytics.domain.model;

/**
 * Budget health derived from utilization (actual spend / budget amount).
 */
public enum BudgetStatus {
    HEALTHY("Healthy", "success"),
    WARNING("Warning", "warning"),
    CRITICAL("Critical", "danger"),
    EXCEEDED("Exceeded", "critical");

    private final String displayLabel;
    private final String severityLevel;

    BudgetStatus(String displayLabel, String severityLevel) {
        this.displayLabel = displayLabel;
        this.severityLevel = severityLevel;
    }

    public String getDisplayLabel() {
        return displayLabel;
    }

    /**
     * UI severity indicator: success, warning, danger, critical
     */
    public String getSeverityLevel() {
        return severityLevel;
    }

    public static BudgetStatus fromUtilization(double utilization) {
        if (utilization >= 1.0) {
            return EXCEEDED;
        }
        if (utilization >= 0.9) {
            return CRITICAL;
        }
        if (utilization >= 0.75) {
            return WARNING;
        }
        return HEALTHY;
    }
}
