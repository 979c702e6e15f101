package com.microsoft.costanalytics.rootcause;

/**
 * Aggregated cost increase of all resources of one service type.
 *
 * @param contribution share of the total increase across services, in percent
 */
public record ServiceContribution(
        String service,
        double costIncrease,
        int resourceCount,
        double avgIncreasePerResource,
        double contribution
) {
}
