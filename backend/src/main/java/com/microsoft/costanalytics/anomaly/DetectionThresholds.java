package com.microsoft.costanalytics.anomaly;

import com.microsoft.costanalytics.domain.model.AnomalySeverity;
import lombok.Builder;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable anomaly detection thresholds.
 *
 * FLAGGING (any one is enough):
 * - deviation in baseline standard deviations &gt;= costSpikeThreshold
 * - percentage increase over expected &gt;= percentageIncreaseThreshold
 * - absolute increase over expected (USD) &gt;= absoluteCostThreshold
 *
 * SEVERITY MAPPING (on the standard deviation score):
 * - CRITICAL &gt;= criticalThreshold, HIGH &gt;= highThreshold, MEDIUM &gt;= mediumThreshold, else LOW
 *
 * Instances are validated on construction: values must be finite and
 * non-negative, and medium &lt;= high &lt;= critical.
 */
@Builder(toBuilder = true)
public record DetectionThresholds(
        double costSpikeThreshold,
        double percentageIncreaseThreshold,
        double absoluteCostThreshold,
        double criticalThreshold,
        double highThreshold,
        double mediumThreshold
) {

    public static final String COST_SPIKE_THRESHOLD = "cost_spike_threshold";
    public static final String PERCENTAGE_INCREASE_THRESHOLD = "percentage_increase_threshold";
    public static final String ABSOLUTE_COST_THRESHOLD = "absolute_cost_threshold";
    public static final String CRITICAL_THRESHOLD = "critical_threshold";
    public static final String HIGH_THRESHOLD = "high_threshold";
    public static final String MEDIUM_THRESHOLD = "medium_threshold";

    public static final Set<String> FIELD_NAMES = Set.of(
            COST_SPIKE_THRESHOLD, PERCENTAGE_INCREASE_THRESHOLD, ABSOLUTE_COST_THRESHOLD,
            CRITICAL_THRESHOLD, HIGH_THRESHOLD, MEDIUM_THRESHOLD
    );

    private static final DetectionThresholds DEFAULTS = new DetectionThresholds(3.0, 50.0, 100.0, 5.0, 3.5, 2.0);

    public DetectionThresholds {
        requireValid(COST_SPIKE_THRESHOLD, costSpikeThreshold);
        requireValid(PERCENTAGE_INCREASE_THRESHOLD, percentageIncreaseThreshold);
        requireValid(ABSOLUTE_COST_THRESHOLD, absoluteCostThreshold);
        requireValid(CRITICAL_THRESHOLD, criticalThreshold);
        requireValid(HIGH_THRESHOLD, highThreshold);
        requireValid(MEDIUM_THRESHOLD, mediumThreshold);
        if (mediumThreshold > highThreshold || highThreshold > criticalThreshold) {
            throw new InvalidThresholdException(String.format(
                    "Severity thresholds must satisfy medium <= high <= critical (got %s, %s, %s)",
                    mediumThreshold, highThreshold, criticalThreshold));
        }
    }

    public static DetectionThresholds defaults() {
        return DEFAULTS;
    }

    /**
     * Build thresholds from a flat map of snake_case names, starting from {@code base}
     * for any name not present. Values may be numbers or numeric strings.
     */
    public static DetectionThresholds fromMap(Map<String, ?> values, DetectionThresholds base) {
        if (values == null || values.isEmpty()) {
            return base;
        }
        for (String key : values.keySet()) {
            if (!FIELD_NAMES.contains(key)) {
                throw new InvalidThresholdException("Unknown threshold: " + key);
            }
        }
        return new DetectionThresholds(
                read(values, COST_SPIKE_THRESHOLD, base.costSpikeThreshold()),
                read(values, PERCENTAGE_INCREASE_THRESHOLD, base.percentageIncreaseThreshold()),
                read(values, ABSOLUTE_COST_THRESHOLD, base.absoluteCostThreshold()),
                read(values, CRITICAL_THRESHOLD, base.criticalThreshold()),
                read(values, HIGH_THRESHOLD, base.highThreshold()),
                read(values, MEDIUM_THRESHOLD, base.mediumThreshold())
        );
    }

    public Map<String, Double> toMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put(COST_SPIKE_THRESHOLD, costSpikeThreshold);
        map.put(PERCENTAGE_INCREASE_THRESHOLD, percentageIncreaseThreshold);
        map.put(ABSOLUTE_COST_THRESHOLD, absoluteCostThreshold);
        map.put(CRITICAL_THRESHOLD, criticalThreshold);
        map.put(HIGH_THRESHOLD, highThreshold);
        map.put(MEDIUM_THRESHOLD, mediumThreshold);
        return map;
    }

    /**
     * Monotonic mapping from deviation score to severity.
     */
    public AnomalySeverity classify(double deviationStd) {
        if (deviationStd >= criticalThreshold) {
            return AnomalySeverity.CRITICAL;
        }
        if (deviationStd >= highThreshold) {
            return AnomalySeverity.HIGH;
        }
        if (deviationStd >= mediumThreshold) {
            return AnomalySeverity.MEDIUM;
        }
        return AnomalySeverity.LOW;
    }

    private static double read(Map<String, ?> values, String key, double fallback) {
        if (!values.containsKey(key)) {
            return fallback;
        }
        Object raw = values.get(key);
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        if (raw instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new InvalidThresholdException("Threshold " + key + " is not numeric: " + text, e);
            }
        }
        throw new InvalidThresholdException("Threshold " + key + " is not numeric: " + raw);
    }

    private static void requireValid(String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new InvalidThresholdException("Threshold " + name + " must be a finite number: " + value);
        }
        if (value < 0) {
            throw new InvalidThresholdException("Threshold " + name + " must not be negative: " + value);
        }
    }
}
