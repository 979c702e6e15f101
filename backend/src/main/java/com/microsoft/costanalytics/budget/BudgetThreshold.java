package com.microsoft.costanalytics.budget;

/**
 * Progressive alert thresholds as fractions of the budget amount.
 */
public enum BudgetThreshold {
    WARNING_50("warning_50", 0.50),
    WARNING_75("warning_75", 0.75),
    CRITICAL_90("critical_90", 0.90),
    EXCEEDED_100("exceeded_100", 1.00);

    private final String thresholdName;
    private final double fraction;

    BudgetThreshold(String thresholdName, double fraction) {
        this.thresholdName = thresholdName;
        this.fraction = fraction;
    }

    public String getThresholdName() {
        return thresholdName;
    }

    public double getFraction() {
        return fraction;
    }
}
