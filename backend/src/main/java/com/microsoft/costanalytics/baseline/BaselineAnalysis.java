package com.microsoft.costanalytics.baseline;

import com.microsoft.costanalytics.domain.model.BaselineModelType;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of baseline establishment.
 *
 * When {@code established} is false the candidate model map is empty, the
 * selected model is null and no anomalies may be derived from this analysis.
 * Statistics are still reported for whatever well-formed data was supplied.
 */
public record BaselineAnalysis(
        boolean established,
        String reason,
        BaselineStatistics statistics,
        Map<BaselineModelType, BaselineModel> candidateModels,
        BaselineModel selectedModel,
        BaselinePeriod period,
        int skippedObservations
) {

    static BaselineAnalysis notEstablished(String reason, BaselineStatistics statistics,
                                           BaselinePeriod period, int skipped) {
        return new BaselineAnalysis(false, reason, statistics, Map.of(), null, period, skipped);
    }

    public record BaselinePeriod(Instant start, Instant end, int count) {

        static BaselinePeriod empty() {
            return new BaselinePeriod(null, null, 0);
        }
    }
}
