package com.microsoft.costanalytics.baseline;

import com.microsoft.costanalytics.domain.model.BaselineModelType;

import java.util.List;
import java.util.Map;

/**
 * A fitted candidate model of expected cost.
 *
 * @param type              model family
 * @param parameters        model-specific parameters (windowSize, slope/intercept, p10..p90)
 * @param fittedPredictions expected cost for each historical point, aligned with the input
 * @param accuracyScore     fit quality in [0, 100]
 * @param confidenceScore   fit quality discounted for short histories, in [0, 100]
 */
public record BaselineModel(
        BaselineModelType type,
        Map<String, Double> parameters,
        List<Double> fittedPredictions,
        double accuracyScore,
        double confidenceScore
) {

    public static final String WINDOW_SIZE = "windowSize";
    public static final String SLOPE = "slope";
    public static final String INTERCEPT = "intercept";
    public static final String P10 = "p10";
    public static final String P25 = "p25";
    public static final String P50 = "p50";
    public static final String P75 = "p75";
    public static final String P90 = "p90";

    public double parameter(String name) {
        Double value = parameters.get(name);
        return value != null ? value : 0.0;
    }

    /**
     * Expected cost at a historical index. Past the fitted range, linear
     * trends are extrapolated and other models repeat their last prediction.
     */
    public double expectedAt(int index) {
        if (fittedPredictions.isEmpty()) {
            return 0.0;
        }
        if (index >= 0 && index < fittedPredictions.size()) {
            return fittedPredictions.get(index);
        }
        if (type == BaselineModelType.LINEAR_TREND) {
            return parameter(INTERCEPT) + parameter(SLOPE) * index;
        }
        return fittedPredictions.get(fittedPredictions.size() - 1);
    }

    public double lastPrediction() {
        return fittedPredictions.isEmpty() ? 0.0 : fittedPredictions.get(fittedPredictions.size() - 1);
    }
}
