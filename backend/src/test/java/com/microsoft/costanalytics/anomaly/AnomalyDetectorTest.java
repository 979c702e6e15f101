package com.microsoft.costanalytics.anomaly;

import com.microsoft.costanalytics.CostSeriesFixtures;
import com.microsoft.costanalytics.baseline.BaselineModeler;
import com.microsoft.costanalytics.baseline.ObservationSanitizer;
import com.microsoft.costanalytics.config.CostAnalyticsProperties;
import com.microsoft.costanalytics.domain.model.AnomalySeverity;
import com.microsoft.costanalytics.domain.model.BaselineModelType;
import com.microsoft.costanalytics.domain.model.CostObservation;
import com.microsoft.costanalytics.domain.model.ResourceCostRecord;
import com.microsoft.costanalytics.rootcause.ContributingFactor;
import com.microsoft.costanalytics.rootcause.RootCauseAttributor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for AnomalyDetector.
 *
 * Test strategy:
 * 1. No anomalies without an established baseline
 * 2. Spike and moderate-deviation scenarios with default and custom thresholds
 * 3. Deterministic ids and output for identical input
 * 4. Summary, alerts and root cause wiring
 */
class AnomalyDetectorTest {

    private ThresholdRegistry registry;
    private AnomalyDetector detector;

    @BeforeEach
    void setUp() {
        CostAnalyticsProperties properties = new CostAnalyticsProperties();
        ObservationSanitizer sanitizer = new ObservationSanitizer();
        registry = new ThresholdRegistry(DetectionThresholds.defaults());
        detector = new AnomalyDetector(
                sanitizer,
                new BaselineModeler(sanitizer),
                new RootCauseAttributor(properties),
                registry,
                properties
        );
    }

    /**
     * 90 points alternating 950/1050 with one 1170 at index 61: about 3.2
     * standard deviations above the expected cost.
     */
    private static List<CostObservation> moderateDeviationSeries() {
        return CostSeriesFixtures.hourly(90, i -> i == 61 ? 1170.0 : (i % 2 == 0 ? 950.0 : 1050.0));
    }

    @Nested
    @DisplayName("Baseline Gate Tests")
    class BaselineGateTests {

        @Test
        @DisplayName("Should report no anomalies when fewer than 24 points are supplied")
        void shouldSkipDetectionWithoutBaseline() {
            AnomalyDetectionResult result = detector.detect(CostSeriesFixtures.constantWithSpike(23, 100.0, 10, 5000.0));

            assertThat(result.baselineAnalysis().established()).isFalse();
            assertThat(result.anomalies()).isEmpty();
            assertThat(result.alerts()).isEmpty();
            assertThat(result.summary().totalAnomalies()).isZero();
        }

        @Test
        @DisplayName("Should handle an empty observation list without error")
        void shouldHandleEmptyInput() {
            AnomalyDetectionResult result = detector.detect(List.of());

            assertThat(result.hasAnomalies()).isFalse();
            assertThat(result.baselineAnalysis().reason()).isEqualTo("No cost data provided");
            assertThat(result.summary().mostSevereAnomalyId()).isNull();
        }

        @Test
        @DisplayName("Should report nothing for a perfectly constant series")
        void shouldFindNothingInConstantSeries() {
            AnomalyDetectionResult result = detector.detect(CostSeriesFixtures.constant(60, 100.0));

            assertThat(result.baselineAnalysis().established()).isTrue();
            assertThat(result.anomalies()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Spike Detection Tests")
    class SpikeDetectionTests {

        @Test
        @DisplayName("Should flag exactly one severe anomaly for a single spike")
        void shouldFlagSingleSpike() {
            AnomalyDetectionResult result = detector.detect(
                    CostSeriesFixtures.constantWithSpike(60, 100.0, 30, 500.0));

            assertThat(result.anomalies()).hasSize(1);
            Anomaly anomaly = result.anomalies().get(0);
            assertThat(anomaly.severity()).isEqualTo(AnomalySeverity.CRITICAL);
            assertThat(anomaly.timestamp()).isEqualTo(CostSeriesFixtures.hourAt(30));
            assertThat(anomaly.actualCost()).isEqualTo(500.0);
            assertThat(anomaly.expectedCost()).isEqualTo(100.0);
            assertThat(anomaly.absoluteDelta()).isEqualTo(400.0);
            assertThat(anomaly.deviationPct()).isCloseTo(400.0, within(1e-9));
            assertThat(anomaly.deviationStd()).isGreaterThan(5.0);
            assertThat(anomaly.baselineModel()).isEqualTo(BaselineModelType.PERCENTILE);
            assertThat(anomaly.triggers()).containsExactly(
                    AnomalyTrigger.STANDARD_DEVIATION, AnomalyTrigger.PERCENTAGE_INCREASE, AnomalyTrigger.ABSOLUTE_INCREASE);
            assertThat(anomaly.id()).isEqualTo(
                    "anomaly-us-east-1-" + CostSeriesFixtures.hourAt(30).getEpochSecond() + "-0");
            assertThat(anomaly.rootCauseAnalysis()).isNotNull();
            assertThat(anomaly.rootCauseAnalysis().anomalyId()).isEqualTo(anomaly.id());
        }

        @Test
        @DisplayName("Should classify a 3.2 sigma deviation as MEDIUM under the default mapping")
        void shouldClassifyModerateDeviationAsMedium() {
            AnomalyDetectionResult result = detector.detect(moderateDeviationSeries());

            assertThat(result.anomalies()).hasSize(1);
            Anomaly anomaly = result.anomalies().get(0);
            assertThat(anomaly.timestamp()).isEqualTo(CostSeriesFixtures.hourAt(61));
            assertThat(anomaly.expectedCost()).isCloseTo(1000.0, within(50.0));
            assertThat(anomaly.deviationStd()).isBetween(2.8, 3.4);
            assertThat(anomaly.severity()).isEqualTo(DetectionThresholds.defaults().classify(anomaly.deviationStd()));
            assertThat(anomaly.severity()).isEqualTo(AnomalySeverity.MEDIUM);
        }

        @Test
        @DisplayName("Should classify the same deviation as HIGH with a lower high threshold")
        void shouldHonourExplicitThresholds() {
            DetectionThresholds custom = DetectionThresholds.defaults().toBuilder().highThreshold(2.5).build();

            AnomalyDetectionResult result = detector.detect(moderateDeviationSeries(), List.of(), custom);

            assertThat(result.anomalies()).singleElement()
                    .satisfies(anomaly -> assertThat(anomaly.severity()).isEqualTo(AnomalySeverity.HIGH));
            assertThat(result.thresholds()).isEqualTo(custom);
        }

        @Test
        @DisplayName("Should read thresholds from the registry when none are passed")
        void shouldUseRegistrySnapshot() {
            registry.update(Map.of(
                    "cost_spike_threshold", 100,
                    "percentage_increase_threshold", 1000,
                    "absolute_cost_threshold", 1000));

            List<CostObservation> series = CostSeriesFixtures.constantWithSpike(60, 100.0, 30, 500.0);

            assertThat(detector.detect(series).anomalies()).isEmpty();
            assertThat(detector.detect(series, List.of(), DetectionThresholds.defaults()).anomalies()).hasSize(1);
        }

        @Test
        @DisplayName("Should skip malformed observations and still detect the spike")
        void shouldSkipMalformedObservations() {
            List<CostObservation> series = new ArrayList<>(CostSeriesFixtures.constantWithSpike(60, 100.0, 30, 500.0));
            series.add(CostObservation.of(null, 900.0, CostSeriesFixtures.SERVICE, CostSeriesFixtures.REGION));
            series.add(CostObservation.of(Instant.parse("2024-03-01T05:30:00Z"), -40.0,
                    CostSeriesFixtures.SERVICE, CostSeriesFixtures.REGION));

            AnomalyDetectionResult result = detector.detect(series);

            assertThat(result.baselineAnalysis().skippedObservations()).isEqualTo(2);
            assertThat(result.anomalies()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Determinism and Reporting Tests")
    class ReportingTests {

        @Test
        @DisplayName("Should produce identical output for identical input apart from detection time")
        void shouldBeDeterministic() {
            List<CostObservation> series = CostSeriesFixtures.hourly(72,
                    i -> i == 20 ? 900.0 : i == 50 ? 400.0 : 100.0 + (i % 4) * 5);
            List<ResourceCostRecord> resources = List.of(
                    new ResourceCostRecord("i-1", "ec2", "us-east-1", 300.0, 100.0));

            AnomalyDetectionResult first = detector.detect(series, resources);
            AnomalyDetectionResult second = detector.detect(series, resources);

            assertThat(first.anomalies()).isNotEmpty();
            assertThat(second.anomalies())
                    .usingRecursiveFieldByFieldElementComparatorIgnoringFields("detectedAt")
                    .containsExactlyElementsOf(first.anomalies());
            assertThat(second.summary()).isEqualTo(first.summary());
        }

        @Test
        @DisplayName("Should number anomaly ids by detection order")
        void shouldNumberIds() {
            List<CostObservation> series = CostSeriesFixtures.hourly(72,
                    i -> i == 20 ? 900.0 : i == 50 ? 400.0 : 100.0);

            List<Anomaly> anomalies = detector.detect(series).anomalies();

            assertThat(anomalies).extracting(Anomaly::id).containsExactly(
                    "anomaly-us-east-1-" + CostSeriesFixtures.hourAt(20).getEpochSecond() + "-0",
                    "anomaly-us-east-1-" + CostSeriesFixtures.hourAt(50).getEpochSecond() + "-1");
        }

        @Test
        @DisplayName("Should summarize counts, impact and the most severe anomaly")
        void shouldSummarize() {
            List<CostObservation> series = CostSeriesFixtures.hourly(72,
                    i -> i == 20 ? 900.0 : i == 50 ? 400.0 : 100.0);

            AnomalyDetectionResult result = detector.detect(series);
            DetectionSummary summary = result.summary();

            assertThat(summary.totalAnomalies()).isEqualTo(2);
            assertThat(summary.totalCostImpact()).isCloseTo(800.0 + 300.0, within(1e-9));
            assertThat(summary.severityBreakdown()).containsOnlyKeys(AnomalySeverity.values());
            assertThat(summary.severityBreakdown().values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(2);
            assertThat(summary.mostSevereAnomalyId()).isEqualTo(result.anomalies().get(0).id());
        }

        @Test
        @DisplayName("Should raise alerts with a readable description for MEDIUM and above")
        void shouldRaiseAlerts() {
            AnomalyDetectionResult result = detector.detect(
                    CostSeriesFixtures.constantWithSpike(60, 100.0, 30, 500.0));

            assertThat(result.alerts()).hasSize(1);
            AnomalyAlert alert = result.alerts().get(0);
            assertThat(alert.anomalyId()).isEqualTo(result.anomalies().get(0).id());
            assertThat(alert.alertId()).startsWith("alert-anomaly-");
            assertThat(alert.description())
                    .isEqualTo("Cost spike detected: $500.00 vs expected $100.00 (+400.0% deviation)");
            assertThat(alert.recommendations()).isNotEmpty();
        }

        @Test
        @DisplayName("Should not alert on LOW severity anomalies")
        void shouldNotAlertOnLowSeverity() {
            DetectionThresholds lowOnly = DetectionThresholds.defaults().toBuilder()
                    .mediumThreshold(50).highThreshold(60).criticalThreshold(70).build();

            AnomalyDetectionResult result = detector.detect(
                    CostSeriesFixtures.constantWithSpike(60, 100.0, 30, 500.0), List.of(), lowOnly);

            assertThat(result.anomalies()).singleElement()
                    .satisfies(anomaly -> assertThat(anomaly.severity()).isEqualTo(AnomalySeverity.LOW));
            assertThat(result.alerts()).isEmpty();
        }

        @Test
        @DisplayName("Should attribute anomalies to the supplied resources")
        void shouldAttributeToResources() {
            List<ResourceCostRecord> resources = List.of(
                    new ResourceCostRecord("i-1", "ec2", "us-east-1", 350.0, 100.0),
                    new ResourceCostRecord("db-1", "rds", "us-east-1", 250.0, 100.0));

            AnomalyDetectionResult result = detector.detect(
                    CostSeriesFixtures.constantWithSpike(60, 100.0, 30, 500.0), resources);

            assertThat(result.anomalies().get(0).rootCauseAnalysis().contributingFactors())
                    .extracting(ContributingFactor::name)
                    .containsExactly("ec2", "rds", "i-1", "db-1");
        }
    }
}
