package com.microsoft.costanalytics.anomaly;

import com.microsoft.costanalytics.config.CostAnalyticsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder of the active detection thresholds.
 *
 * Readers take an immutable snapshot once per detection call; writers swap
 * the whole snapshot. Updates are validated before they become visible, so a
 * rejected update leaves the previous thresholds in place.
 */
@Component
@Slf4j
public class ThresholdRegistry {

    private final AtomicReference<DetectionThresholds> current;

    @Autowired
    public ThresholdRegistry(CostAnalyticsProperties properties) {
        this(properties.getDetection().toThresholds());
    }

    public ThresholdRegistry(DetectionThresholds initial) {
        this.current = new AtomicReference<>(initial);
        log.info("Detection thresholds initialized: {}", initial.toMap());
    }

    public DetectionThresholds current() {
        return current.get();
    }

    public DetectionThresholds replace(DetectionThresholds thresholds) {
        if (thresholds == null) {
            throw new InvalidThresholdException("Thresholds must not be null");
        }
        current.set(thresholds);
        log.info("Detection thresholds replaced: {}", thresholds.toMap());
        return thresholds;
    }

    /**
     * Apply a partial update from a flat map of snake_case names.
     *
     * @return the thresholds now in effect
     * @throws InvalidThresholdException for unknown names, non-numeric or out-of-range values
     */
    public DetectionThresholds update(Map<String, ?> values) {
        DetectionThresholds updated = current.updateAndGet(existing -> DetectionThresholds.fromMap(values, existing));
        log.info("Detection thresholds updated: {}", updated.toMap());
        return updated;
    }
}
