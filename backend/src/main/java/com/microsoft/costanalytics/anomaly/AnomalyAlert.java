package com.microsoft.costanalytics.anomaly;

import com.microsoft.costanalytics.domain.model.AnomalySeverity;
import com.microsoft.costanalytics.rootcause.RootCauseRecommendation;

import java.util.List;

/**
 * Alert raised for an anomaly of MEDIUM severity or above.
 */
public record AnomalyAlert(
        String alertId,
        String anomalyId,
        AnomalySeverity severity,
        String title,
        String description,
        String region,
        List<RootCauseRecommendation> recommendations
) {
}
