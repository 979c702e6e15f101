package com.microsoft.costanalytics.service;

import com.microsoft.costanalytics.CostSeriesFixtures;
import com.microsoft.costanalytics.anomaly.AnomalyDetector;
import com.microsoft.costanalytics.anomaly.DetectionThresholds;
import com.microsoft.costanalytics.anomaly.ThresholdRegistry;
import com.microsoft.costanalytics.baseline.BaselineAnalysis;
import com.microsoft.costanalytics.baseline.BaselineModeler;
import com.microsoft.costanalytics.budget.BudgetVarianceEngine;
import com.microsoft.costanalytics.config.CostAnalyticsProperties;
import com.microsoft.costanalytics.domain.model.CostObservation;
import com.microsoft.costanalytics.forecast.ForecastProjector;
import com.microsoft.costanalytics.forecast.ForecastRequest;
import com.microsoft.costanalytics.forecast.HistoricalTrendAnalyzer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for CostAnalyticsService orchestration.
 */
@ExtendWith(MockitoExtension.class)
class CostAnalyticsServiceTest {

    @Mock
    private BaselineModeler baselineModeler;

    @Mock
    private AnomalyDetector anomalyDetector;

    @Mock
    private ForecastProjector forecastProjector;

    @Mock
    private HistoricalTrendAnalyzer trendAnalyzer;

    @Mock
    private BudgetVarianceEngine budgetVarianceEngine;

    @Mock
    private ThresholdRegistry thresholdRegistry;

    @Spy
    private CostAnalyticsProperties properties = new CostAnalyticsProperties();

    @InjectMocks
    private CostAnalyticsService service;

    @Nested
    @DisplayName("Baseline Tests")
    class BaselineTests {

        @Test
        @DisplayName("Should use the configured minimum point count")
        void shouldUseConfiguredMinPoints() {
            properties.getBaseline().setMinPoints(36);
            List<CostObservation> observations = CostSeriesFixtures.constant(40, 10.0);

            service.establishBaseline(observations);

            verify(baselineModeler).establishBaseline(observations, 36);
        }

        @Test
        @DisplayName("Should reject a missing observation list")
        void shouldRejectNullObservations() {
            assertThatThrownBy(() -> service.establishBaseline(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("observations");
            verifyNoInteractions(baselineModeler);
        }
    }

    @Nested
    @DisplayName("Detection Tests")
    class DetectionTests {

        @Test
        @DisplayName("Should delegate to the detector with registry thresholds by default")
        void shouldDelegateDetection() {
            List<CostObservation> observations = CostSeriesFixtures.constant(30, 10.0);

            service.detectAnomalies(observations);

            verify(anomalyDetector).detect(eq(observations), eq(List.of()), isNull());
        }

        @Test
        @DisplayName("Should replace missing resources with an empty list")
        void shouldDefaultResources() {
            List<CostObservation> observations = CostSeriesFixtures.constant(30, 10.0);
            DetectionThresholds thresholds = DetectionThresholds.defaults();

            service.detectAnomalies(observations, null, thresholds);

            verify(anomalyDetector).detect(observations, List.of(), thresholds);
        }

        @Test
        @DisplayName("Should reject a missing observation list before detection")
        void shouldRejectNullObservations() {
            assertThatThrownBy(() -> service.detectAnomalies(null))
                    .isInstanceOf(IllegalArgumentException.class);
            verify(anomalyDetector, never()).detect(any(), anyList(), any());
        }
    }

    @Nested
    @DisplayName("Forecast Tests")
    class ForecastTests {

        @Test
        @DisplayName("Should establish a baseline before projecting from observations")
        void shouldProjectFromObservations() {
            List<CostObservation> observations = CostSeriesFixtures.constant(30, 10.0);
            BaselineAnalysis baseline = mock(BaselineAnalysis.class);
            ForecastRequest request = ForecastRequest.of("b", 3);
            when(baselineModeler.establishBaseline(eq(observations), anyInt())).thenReturn(baseline);

            service.projectForecastFromObservations(observations, request);

            verify(forecastProjector).project(baseline, request);
        }

        @Test
        @DisplayName("Should reject a missing monthly history for trend analysis")
        void shouldRejectNullMonthlyCosts() {
            assertThatThrownBy(() -> service.analyzeTrends(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("monthlyCosts");
            verifyNoInteractions(trendAnalyzer);
        }
    }

    @Nested
    @DisplayName("Threshold Tests")
    class ThresholdTests {

        @Test
        @DisplayName("Should read and update thresholds through the registry")
        void shouldDelegateToRegistry() {
            DetectionThresholds updated = DetectionThresholds.defaults().toBuilder().highThreshold(4.0).build();
            Map<String, Object> values = Map.of("high_threshold", 4.0);
            when(thresholdRegistry.update(values)).thenReturn(updated);
            when(thresholdRegistry.current()).thenReturn(updated);

            assertThat(service.updateThresholds(values)).isEqualTo(updated);
            assertThat(service.currentThresholds().highThreshold()).isEqualTo(4.0);
        }
    }
}
