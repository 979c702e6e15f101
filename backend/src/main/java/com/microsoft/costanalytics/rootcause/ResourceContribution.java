package com.microsoft.costanalytics.rootcause;

/**
 * Cost increase of a single resource.
 *
 * @param contribution increase relative to the anomaly's absolute delta, clamped to [0, 100]
 */
public record ResourceContribution(
        String resourceId,
        String resourceType,
        String region,
        double currentCost,
        double historicalCost,
        double costIncrease,
        double contribution
) {
}
