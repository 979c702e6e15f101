package com.microsoft.costanalytics.domain.model;

/**
 * Severity of a detected cost anomaly.
 *
 * Derived from the deviation (in baseline standard deviations) through the
 * configured severity mapping. Ordinal order is significant: later constants
 * are more severe.
 */
public enum AnomalySeverity {
    LOW("Low", false),
    MEDIUM("Medium", true),
    HIGH("High", true),
    CRITICAL("Critical", true);

    private final String displayLabel;
    private final boolean alerting;

    AnomalySeverity(String displayLabel, boolean alerting) {
        this.displayLabel = displayLabel;
        this.alerting = alerting;
    }

    public String getDisplayLabel() {
        return displayLabel;
    }

    /**
     * Whether anomalies of this severity produce an alert.
     */
    public boolean isAlerting() {
        return alerting;
    }

    public boolean isAtLeast(AnomalySeverity other) {
        return compareTo(other) >= 0;
    }
}
