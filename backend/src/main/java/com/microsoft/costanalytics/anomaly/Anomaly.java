package com.microsoft.costanalytics.anomaly;

import com.microsoft.costanalytics.domain.model.AnomalySeverity;
import com.microsoft.costanalytics.domain.model.BaselineModelType;
import com.microsoft.costanalytics.rootcause.RootCauseAnalysis;

import java.time.Instant;
import java.util.List;

/**
 * A cost observation that deviated from its baseline.
 *
 * @param id            deterministic identifier {@code anomaly-{region}-{epochSecond}-{ordinal}}
 * @param deviationStd  (actual - expected) in baseline standard deviations
 * @param deviationPct  (actual - expected) as a percentage of expected
 * @param absoluteDelta actual - expected, in USD
 * @param triggers      detection rules that fired, in declaration order
 */
public record Anomaly(
        String id,
        Instant timestamp,
        double actualCost,
        double expectedCost,
        double deviationStd,
        double deviationPct,
        double absoluteDelta,
        AnomalySeverity severity,
        List<AnomalyTrigger> triggers,
        BaselineModelType baselineModel,
        String service,
        String region,
        String resourceId,
        Instant detectedAt,
        RootCauseAnalysis rootCauseAnalysis
) {

    public Anomaly withRootCauseAnalysis(RootCauseAnalysis analysis) {
        return new Anomaly(id, timestamp, actualCost, expectedCost, deviationStd, deviationPct, absoluteDelta,
                severity, triggers, baselineModel, service, region, resourceId, detectedAt, analysis);
    }
}
