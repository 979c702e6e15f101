package com.microsoft.costanalytics.anomaly;

/**
 * Detection rule that flagged an observation.
 */
public enum AnomalyTrigger {
    STANDARD_DEVIATION,
    PERCENTAGE_INCREASE,
    ABSOLUTE_INCREASE
}
