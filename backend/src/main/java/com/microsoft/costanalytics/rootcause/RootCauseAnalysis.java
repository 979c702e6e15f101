package com.microsoft.costanalytics.rootcause;

import java.util.List;
import java.util.Map;

/**
 * Attribution of one anomaly to services and resources.
 *
 * Contributing factors list every service first (highest contribution first),
 * then the top resources by cost increase. Recommendations are never empty.
 */
public record RootCauseAnalysis(
        String anomalyId,
        List<ContributingFactor> contributingFactors,
        Map<String, ServiceContribution> serviceBreakdown,
        Map<String, ResourceContribution> resourceBreakdown,
        TimeWindowAnalysis timeWindow,
        List<RootCauseRecommendation> recommendations
) {
}
