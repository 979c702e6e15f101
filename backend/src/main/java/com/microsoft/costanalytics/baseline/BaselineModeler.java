package com.microsoft.costanalytics.baseline;

import com.microsoft.costanalytics.domain.model.BaselineModelType;
import com.microsoft.costanalytics.domain.model.CostObservation;
import com.microsoft.costanalytics.statistics.TimeSeriesStatistics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Establishes a statistical baseline of normal spending.
 *
 * MODEL CANDIDATES:
 * 1. Moving average: trailing window of at most 24 points
 * 2. Linear trend: OLS fit of cost against observation index
 * 3. Percentile band: median prediction with P10/P90 band
 *
 * SCORING:
 * Accuracy is 1 - normalized mean absolute error, scaled to 0-100.
 * Confidence discounts accuracy for histories shorter than 48 points.
 *
 * SELECTION:
 * Highest accuracy wins; ties go to LINEAR_TREND, then MOVING_AVERAGE,
 * then PERCENTILE.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BaselineModeler {

    public static final int DEFAULT_MIN_POINTS = 24;
    static final int MOVING_AVERAGE_WINDOW = 24;
    static final int FULL_CONFIDENCE_POINTS = 48;
    private static final double FLOATING_POINT_TOLERANCE = 1e-9;

    private static final Comparator<BaselineModel> SELECTION_ORDER =
            Comparator.comparingDouble(BaselineModel::accuracyScore).reversed()
                    .thenComparingInt(model -> model.type().getSelectionPriority());

    private final ObservationSanitizer sanitizer;

    public BaselineAnalysis establishBaseline(List<CostObservation> observations) {
        return establishBaseline(observations, DEFAULT_MIN_POINTS);
    }

    public BaselineAnalysis establishBaseline(List<CostObservation> observations, int minPoints) {
        return establishBaseline(sanitizer.sanitize(observations), minPoints);
    }

    /**
     * Establish a baseline from observations that were already sanitized.
     */
    public BaselineAnalysis establishBaseline(ObservationSanitizer.SanitizedObservations series, int minPoints) {
        if (minPoints < 1) {
            throw new IllegalArgumentException("Minimum baseline points must be positive: " + minPoints);
        }

        double[] costs = series.costs();
        BaselineStatistics statistics = costs.length == 0 ? BaselineStatistics.empty() : BaselineStatistics.of(costs);
        BaselineAnalysis.BaselinePeriod period = series.isEmpty()
                ? BaselineAnalysis.BaselinePeriod.empty()
                : new BaselineAnalysis.BaselinePeriod(
                        series.observations().get(0).timestamp(),
                        series.observations().get(series.size() - 1).timestamp(),
                        series.size());

        if (costs.length < minPoints) {
            String reason = costs.length == 0
                    ? "No cost data provided"
                    : "Insufficient data points: " + costs.length + " < " + minPoints;
            log.info("Baseline not established: {}", reason);
            return BaselineAnalysis.notEstablished(reason, statistics, period, series.skipped());
        }

        Map<BaselineModelType, BaselineModel> candidates = new EnumMap<>(BaselineModelType.class);
        candidates.put(BaselineModelType.MOVING_AVERAGE, fitMovingAverage(costs));
        candidates.put(BaselineModelType.LINEAR_TREND, fitLinearTrend(costs));
        candidates.put(BaselineModelType.PERCENTILE, fitPercentileBand(costs));

        BaselineModel selected = selectBestModel(candidates.values().stream().toList());

        log.info("Baseline established from {} points: selected {} (accuracy={}, confidence={})",
                costs.length, selected.type(),
                String.format("%.1f", selected.accuracyScore()),
                String.format("%.1f", selected.confidenceScore()));

        return new BaselineAnalysis(
                true,
                null,
                statistics,
                Collections.unmodifiableMap(candidates),
                selected,
                period,
                series.skipped()
        );
    }

    /**
     * Explicit stable sort over (accuracy desc, type priority asc).
     */
    BaselineModel selectBestModel(List<BaselineModel> candidates) {
        return candidates.stream()
                .sorted(SELECTION_ORDER)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No baseline candidates to select from"));
    }

    BaselineModel fitMovingAverage(double[] costs) {
        int window = Math.min(MOVING_AVERAGE_WINDOW, costs.length);
        double[] predictions = TimeSeriesStatistics.movingAverage(costs, window);
        return score(BaselineModelType.MOVING_AVERAGE,
                Map.of(BaselineModel.WINDOW_SIZE, (double) window), costs, predictions);
    }

    BaselineModel fitLinearTrend(double[] costs) {
        TimeSeriesStatistics.LinearFit fit = TimeSeriesStatistics.linearRegression(costs);
        double[] predictions = new double[costs.length];
        for (int i = 0; i < costs.length; i++) {
            predictions[i] = fit.predict(i);
        }
        return score(BaselineModelType.LINEAR_TREND,
                Map.of(BaselineModel.SLOPE, fit.slope(), BaselineModel.INTERCEPT, fit.intercept()),
                costs, predictions);
    }

    BaselineModel fitPercentileBand(double[] costs) {
        double median = TimeSeriesStatistics.median(costs);
        double[] predictions = new double[costs.length];
        Arrays.fill(predictions, median);
        Map<String, Double> percentiles = Map.of(
                BaselineModel.P10, TimeSeriesStatistics.percentile(costs, 10),
                BaselineModel.P25, TimeSeriesStatistics.percentile(costs, 25),
                BaselineModel.P50, median,
                BaselineModel.P75, TimeSeriesStatistics.percentile(costs, 75),
                BaselineModel.P90, TimeSeriesStatistics.percentile(costs, 90)
        );
        return score(BaselineModelType.PERCENTILE, percentiles, costs, predictions);
    }

    private BaselineModel score(BaselineModelType type, Map<String, Double> parameters,
                                double[] costs, double[] predictions) {
        double accuracy = calculateAccuracy(costs, predictions);
        double confidence = calculateConfidence(accuracy, costs.length);
        log.debug("Candidate {}: accuracy={}, confidence={}", type, accuracy, confidence);
        return new BaselineModel(
                type,
                parameters,
                Arrays.stream(predictions).boxed().toList(),
                accuracy,
                confidence
        );
    }

    /**
     * 1 - MAE / mean(|actual|), scaled to [0, 100]. A perfect fit scores 100
     * even on an all-zero series; rounding noise below 1e-9 of the scale counts
     * as a perfect fit.
     */
    static double calculateAccuracy(double[] actual, double[] predicted) {
        double mae = TimeSeriesStatistics.meanAbsoluteError(actual, predicted);
        double scale = Arrays.stream(actual).map(Math::abs).average().orElse(0.0);
        if (mae <= FLOATING_POINT_TOLERANCE * Math.max(1.0, scale)) {
            return 100.0;
        }
        if (scale == 0) {
            return 0.0;
        }
        return TimeSeriesStatistics.clamp((1 - mae / scale) * 100, 0, 100);
    }

    static double calculateConfidence(double accuracy, int dataPoints) {
        double dataFactor = Math.min(1.0, dataPoints / (double) FULL_CONFIDENCE_POINTS);
        return TimeSeriesStatistics.clamp(accuracy * (0.5 + 0.5 * dataFactor), 0, 100);
    }
}
