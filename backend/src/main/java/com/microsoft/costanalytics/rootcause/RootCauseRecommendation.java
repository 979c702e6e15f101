package com.microsoft.costanalytics.rootcause;

import com.microsoft.costanalytics.domain.model.RecommendationPriority;

/**
 * Follow-up action suggested by root cause attribution.
 *
 * @param target service name or resource id the action applies to, null for general advice
 */
public record RootCauseRecommendation(
        RecommendationType type,
        RecommendationPriority priority,
        String title,
        String description,
        String action,
        String target
) {

    public enum RecommendationType {
        SERVICE_INVESTIGATION,
        RESOURCE_INVESTIGATION,
        GENERAL_INVESTIGATION,
        MONITORING
    }
}
