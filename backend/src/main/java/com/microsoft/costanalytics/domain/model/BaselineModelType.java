package com.microsoft.costanalytics.domain.model;

/**
 * Candidate baseline models.
 *
 * Selection priority breaks accuracy ties: lower value wins.
 */
public enum BaselineModelType {
    /**
     * Ordinary least squares fit of cost against observation index.
     */
    LINEAR_TREND("Linear trend", 0),

    /**
     * Trailing moving average over at most 24 points.
     */
    MOVING_AVERAGE("Moving average", 1),

    /**
     * Median prediction with a P10-P90 band.
     */
    PERCENTILE("Percentile band", 2);

    private final String displayName;
    private final int selectionPriority;

    BaselineModelType(String displayName, int selectionPriority) {
        this.displayName = displayName;
        this.selectionPriority = selectionPriority;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getSelectionPriority() {
        return selectionPriority;
    }
}
