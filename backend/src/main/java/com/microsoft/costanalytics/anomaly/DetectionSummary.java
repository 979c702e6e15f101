package com.microsoft.costanalytics.anomaly;

import com.microsoft.costanalytics.domain.model.AnomalySeverity;

import java.util.Map;

/**
 * Aggregate view of one detection run.
 *
 * @param severityBreakdown count per severity, every severity present
 * @param totalCostImpact   sum of (actual - expected) over all anomalies
 * @param mostSevereAnomalyId highest severity, earliest first on ties; null when none
 */
public record DetectionSummary(
        int totalAnomalies,
        Map<AnomalySeverity, Integer> severityBreakdown,
        double totalCostImpact,
        String mostSevereAnomalyId
) {
}
