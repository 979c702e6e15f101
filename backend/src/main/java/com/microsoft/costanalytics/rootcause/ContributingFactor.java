package com.microsoft.costanalytics.rootcause;

/**
 * A service or resource that contributed to an anomaly.
 *
 * @param name         service name, or resource id for resource factors
 * @param contribution share of the anomaly in percent, within [0, 100]
 */
public record ContributingFactor(
        ContributorType type,
        String name,
        String resourceId,
        String resourceType,
        double contribution,
        double costIncrease,
        String description
) {

    public enum ContributorType {
        SERVICE,
        RESOURCE
    }
}
