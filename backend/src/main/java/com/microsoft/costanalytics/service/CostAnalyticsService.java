package com.microsoft.costanalytics.service;

import com.microsoft.costanalytics.anomaly.AnomalyDetectionResult;
import com.microsoft.costanalytics.anomaly.AnomalyDetector;
import com.microsoft.costanalytics.anomaly.DetectionThresholds;
import com.microsoft.costanalytics.anomaly.ThresholdRegistry;
import com.microsoft.costanalytics.baseline.BaselineAnalysis;
import com.microsoft.costanalytics.baseline.BaselineModeler;
import com.microsoft.costanalytics.budget.BudgetVariance;
import com.microsoft.costanalytics.budget.BudgetVarianceEngine;
import com.microsoft.costanalytics.config.CostAnalyticsProperties;
import com.microsoft.costanalytics.domain.model.CostObservation;
import com.microsoft.costanalytics.domain.model.ResourceCostRecord;
import com.microsoft.costanalytics.forecast.Forecast;
import com.microsoft.costanalytics.forecast.ForecastProjector;
import com.microsoft.costanalytics.forecast.ForecastRequest;
import com.microsoft.costanalytics.forecast.HistoricalTrendAnalyzer;
import com.microsoft.costanalytics.forecast.MonthlyCost;
import com.microsoft.costanalytics.forecast.TrendAnalysis;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Entry point to the analytics core.
 *
 * Orchestrates baseline modeling, anomaly detection, forecasting and budget
 * variance analysis. Holds no state of its own; detection thresholds live in
 * the {@link ThresholdRegistry}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CostAnalyticsService {

    private final BaselineModeler baselineModeler;
    private final AnomalyDetector anomalyDetector;
    private final ForecastProjector forecastProjector;
    private final HistoricalTrendAnalyzer trendAnalyzer;
    private final BudgetVarianceEngine budgetVarianceEngine;
    private final ThresholdRegistry thresholdRegistry;
    private final CostAnalyticsProperties properties;

    public BaselineAnalysis establishBaseline(List<CostObservation> observations) {
        return establishBaseline(observations, properties.getBaseline().getMinPoints());
    }

    public BaselineAnalysis establishBaseline(List<CostObservation> observations, int minPoints) {
        requireList(observations, "observations");
        return baselineModeler.establishBaseline(observations, minPoints);
    }

    public AnomalyDetectionResult detectAnomalies(List<CostObservation> observations) {
        return detectAnomalies(observations, List.of(), null);
    }

    /**
     * @param thresholds explicit thresholds, or null to use the registry's current snapshot
     */
    public AnomalyDetectionResult detectAnomalies(List<CostObservation> observations,
                                                  List<ResourceCostRecord> resources,
                                                  DetectionThresholds thresholds) {
        requireList(observations, "observations");
        return anomalyDetector.detect(observations, resources == null ? List.of() : resources, thresholds);
    }

    public Forecast projectForecast(BaselineAnalysis baseline, ForecastRequest request) {
        return forecastProjector.project(baseline, request);
    }

    public Forecast projectForecast(List<MonthlyCost> monthlyCosts, ForecastRequest request) {
        return forecastProjector.project(monthlyCosts, request);
    }

    /**
     * Establish a baseline from raw observations and project it forward.
     */
    public Forecast projectForecastFromObservations(List<CostObservation> observations, ForecastRequest request) {
        requireList(observations, "observations");
        return forecastProjector.project(establishBaseline(observations), request);
    }

    public TrendAnalysis analyzeTrends(List<MonthlyCost> monthlyCosts) {
        requireList(monthlyCosts, "monthlyCosts");
        return trendAnalyzer.analyze(monthlyCosts);
    }

    public BudgetVariance analyzeVariance(Forecast forecast, double actualSpend, double budgetAmount, String budgetId) {
        return budgetVarianceEngine.analyze(forecast, actualSpend, budgetAmount, budgetId);
    }

    public DetectionThresholds currentThresholds() {
        return thresholdRegistry.current();
    }

    public DetectionThresholds updateThresholds(Map<String, ?> values) {
        return thresholdRegistry.update(values);
    }

    private static void requireList(List<?> values, String name) {
        if (values == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
    }
}
