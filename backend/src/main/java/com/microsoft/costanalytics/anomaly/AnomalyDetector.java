package com.microsoft.costanalytics.anomaly;

import com.microsoft.costanalytics.baseline.BaselineAnalysis;
import com.microsoft.costanalytics.baseline.BaselineModel;
import com.microsoft.costanalytics.baseline.BaselineModeler;
import com.microsoft.costanalytics.baseline.ObservationSanitizer;
import com.microsoft.costanalytics.config.CostAnalyticsProperties;
import com.microsoft.costanalytics.domain.model.AnomalySeverity;
import com.microsoft.costanalytics.domain.model.CostObservation;
import com.microsoft.costanalytics.domain.model.ResourceCostRecord;
import com.microsoft.costanalytics.rootcause.RootCauseAttributor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flags cost observations that deviate from the established baseline.
 *
 * DETECTION FLOW:
 * 1. Sanitize the observations and establish a baseline
 * 2. Compare each observation with the selected model's expected cost
 * 3. Flag when any threshold fires (deviation, percentage, absolute)
 * 4. Classify severity from the deviation in standard deviations
 * 5. Attribute each anomaly to services and resources
 * 6. Summarize and raise alerts for MEDIUM severity and above
 *
 * No anomalies are reported when the baseline cannot be established.
 * Thresholds are read once per call, so a concurrent update never mixes
 * two threshold sets within one run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnomalyDetector {

    private static final double FLOATING_POINT_TOLERANCE = 1e-9;
    private static final String UNKNOWN_REGION = "unknown";

    private final ObservationSanitizer sanitizer;
    private final BaselineModeler baselineModeler;
    private final RootCauseAttributor rootCauseAttributor;
    private final ThresholdRegistry thresholdRegistry;
    private final CostAnalyticsProperties properties;

    public AnomalyDetectionResult detect(List<CostObservation> observations) {
        return detect(observations, List.of(), null);
    }

    public AnomalyDetectionResult detect(List<CostObservation> observations, List<ResourceCostRecord> resources) {
        return detect(observations, resources, null);
    }

    /**
     * @param resources  resource cost records for root cause attribution, may be empty
     * @param thresholds explicit thresholds, or null for the registry's current snapshot
     */
    public AnomalyDetectionResult detect(List<CostObservation> observations,
                                         List<ResourceCostRecord> resources,
                                         DetectionThresholds thresholds) {
        DetectionThresholds active = thresholds != null ? thresholds : thresholdRegistry.current();
        Instant detectedAt = Instant.now();

        ObservationSanitizer.SanitizedObservations series = sanitizer.sanitize(observations);
        BaselineAnalysis baseline = baselineModeler.establishBaseline(series, properties.getBaseline().getMinPoints());

        if (!baseline.established()) {
            log.info("Anomaly detection skipped: {}", baseline.reason());
            return new AnomalyDetectionResult(baseline, List.of(), summarize(List.of()), List.of(), active);
        }

        BaselineModel model = baseline.selectedModel();
        double stdDev = baseline.statistics().stdDev();
        double scale = Math.max(1.0, Math.abs(baseline.statistics().mean()));
        if (stdDev <= FLOATING_POINT_TOLERANCE * scale) {
            stdDev = 0.0;
        }

        List<CostObservation> points = series.observations();
        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < points.size(); i++) {
            CostObservation observation = points.get(i);
            double actual = observation.cost();
            double expected = model.expectedAt(i);
            double delta = actual - expected;
            double deviationStd = stdDev == 0 ? 0.0 : delta / stdDev;
            double deviationPct = expected == 0 ? 0.0 : delta / expected * 100;

            List<AnomalyTrigger> triggers = triggers(active, deviationStd, deviationPct, delta);
            if (triggers.isEmpty()) {
                continue;
            }

            Anomaly anomaly = new Anomaly(
                    anomalyId(observation, anomalies.size()),
                    observation.timestamp(),
                    actual,
                    expected,
                    deviationStd,
                    deviationPct,
                    delta,
                    active.classify(deviationStd),
                    triggers,
                    model.type(),
                    observation.service(),
                    observation.region(),
                    observation.resourceId(),
                    detectedAt,
                    null
            );
            anomalies.add(anomaly.withRootCauseAnalysis(
                    rootCauseAttributor.attribute(anomaly, resources, points)));
        }

        DetectionSummary summary = summarize(anomalies);
        List<AnomalyAlert> alerts = generateAlerts(anomalies);

        log.info("Anomaly detection over {} points ({} model): {} anomalies, {} alerts, impact ${}",
                points.size(), model.type(), anomalies.size(), alerts.size(),
                String.format("%.2f", summary.totalCostImpact()));

        return new AnomalyDetectionResult(baseline, List.copyOf(anomalies), summary, List.copyOf(alerts), active);
    }

    private static List<AnomalyTrigger> triggers(DetectionThresholds thresholds,
                                                 double deviationStd, double deviationPct, double delta) {
        List<AnomalyTrigger> fired = new ArrayList<>(3);
        if (deviationStd >= thresholds.costSpikeThreshold()) {
            fired.add(AnomalyTrigger.STANDARD_DEVIATION);
        }
        if (deviationPct >= thresholds.percentageIncreaseThreshold()) {
            fired.add(AnomalyTrigger.PERCENTAGE_INCREASE);
        }
        if (delta >= thresholds.absoluteCostThreshold()) {
            fired.add(AnomalyTrigger.ABSOLUTE_INCREASE);
        }
        return fired.isEmpty() ? List.of() : List.copyOf(fired);
    }

    private static String anomalyId(CostObservation observation, int ordinal) {
        String region = observation.region() != null && !observation.region().isBlank()
                ? observation.region()
                : UNKNOWN_REGION;
        return "anomaly-" + region + "-" + observation.timestamp().getEpochSecond() + "-" + ordinal;
    }

    DetectionSummary summarize(List<Anomaly> anomalies) {
        Map<AnomalySeverity, Integer> counts = new EnumMap<>(AnomalySeverity.class);
        for (AnomalySeverity severity : AnomalySeverity.values()) {
            counts.put(severity, 0);
        }

        double impact = 0;
        Anomaly mostSevere = null;
        for (Anomaly anomaly : anomalies) {
            counts.merge(anomaly.severity(), 1, Integer::sum);
            impact += anomaly.absoluteDelta();
            if (mostSevere == null || anomaly.severity().compareTo(mostSevere.severity()) > 0) {
                mostSevere = anomaly;
            }
        }

        return new DetectionSummary(
                anomalies.size(),
                Collections.unmodifiableMap(counts),
                impact,
                mostSevere != null ? mostSevere.id() : null
        );
    }

    List<AnomalyAlert> generateAlerts(List<Anomaly> anomalies) {
        List<AnomalyAlert> alerts = new ArrayList<>();
        for (Anomaly anomaly : anomalies) {
            if (!anomaly.severity().isAlerting()) {
                continue;
            }
            alerts.add(new AnomalyAlert(
                    "alert-" + anomaly.id(),
                    anomaly.id(),
                    anomaly.severity(),
                    "Cost Anomaly Detected: " + anomaly.severity().getDisplayLabel() + " severity",
                    describe(anomaly),
                    anomaly.region(),
                    anomaly.rootCauseAnalysis() != null ? anomaly.rootCauseAnalysis().recommendations() : List.of()
            ));
        }
        return alerts;
    }

    static String describe(Anomaly anomaly) {
        return String.format(Locale.ROOT, "Cost spike detected: $%.2f vs expected $%.2f (%+.1f%% deviation)",
                anomaly.actualCost(), anomaly.expectedCost(), anomaly.deviationPct());
    }
}
