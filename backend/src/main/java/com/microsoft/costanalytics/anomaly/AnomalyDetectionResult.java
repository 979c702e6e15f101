package com.microsoft.costanalytics.anomaly;

import com.microsoft.costanalytics.baseline.BaselineAnalysis;

import java.util.List;

public record AnomalyDetectionResult(
        BaselineAnalysis baselineAnalysis,
        List<Anomaly> anomalies,
        DetectionSummary summary,
        List<AnomalyAlert> alerts,
        DetectionThresholds thresholds
) {

    public boolean hasAnomalies() {
        return !anomalies.isEmpty();
    }
}
