package com.microsoft.costanalytics.api;

import com.microsoft.costanalytics.anomaly.AnomalyDetectionResult;
import com.microsoft.costanalytics.anomaly.DetectionThresholds;
import com.microsoft.costanalytics.baseline.BaselineAnalysis;
import com.microsoft.costanalytics.budget.BudgetVariance;
import com.microsoft.costanalytics.config.CostAnalyticsProperties;
import com.microsoft.costanalytics.domain.model.CostObservation;
import com.microsoft.costanalytics.domain.model.ResourceCostRecord;
import com.microsoft.costanalytics.forecast.Forecast;
import com.microsoft.costanalytics.forecast.ForecastRequest;
import com.microsoft.costanalytics.forecast.InfrastructureChange;
import com.microsoft.costanalytics.forecast.MonthlyCost;
import com.microsoft.costanalytics.forecast.TrendAnalysis;
import com.microsoft.costanalytics.service.CostAnalyticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * JSON surface over the analytics core.
 *
 * Stateless: every request carries the cost history it is analyzed on.
 * Malformed observations inside a request are skipped, not rejected.
 */
@RestController
@RequestMapping("/api/analysis")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Cost Analysis", description = "Baselines, anomalies, forecasts and budget variance")
public class CostAnalysisController {

    private final CostAnalyticsService analyticsService;
    private final CostAnalyticsProperties properties;

    @PostMapping("/baseline")
    @Operation(summary = "Establish a cost baseline",
               description = "Fits candidate models over the observations and selects the best one")
    public ResponseEntity<BaselineAnalysis> establishBaseline(@Valid @RequestBody BaselineRequest request) {
        log.info("Baseline request: {} observations", request.observations().size());
        int minPoints = request.minPoints() != null
                ? request.minPoints()
                : properties.getBaseline().getMinPoints();
        return ResponseEntity.ok(analyticsService.establishBaseline(request.observations(), minPoints));
    }

    @PostMapping("/anomalies")
    @Operation(summary = "Detect cost anomalies",
               description = "Flags observations that deviate from the baseline and attributes their root cause")
    public ResponseEntity<AnomalyDetectionResult> detectAnomalies(@Valid @RequestBody AnomalyRequest request) {
        log.info("Anomaly request: {} observations, {} resources",
                request.observations().size(), request.resources() != null ? request.resources().size() : 0);
        DetectionThresholds thresholds = request.thresholds() == null || request.thresholds().isEmpty()
                ? null
                : DetectionThresholds.fromMap(request.thresholds(), analyticsService.currentThresholds());
        return ResponseEntity.ok(analyticsService.detectAnomalies(
                request.observations(), request.resources(), thresholds));
    }

    @PostMapping("/forecast")
    @Operation(summary = "Project future spend",
               description = "Projects monthly spend from monthly history or from raw observations")
    public ResponseEntity<Forecast> projectForecast(@Valid @RequestBody ForecastApiRequest request) {
        ForecastRequest forecastRequest = ForecastRequest.builder()
                .budgetId(request.budgetId())
                .months(request.months() != null ? request.months() : properties.getForecast().getDefaultMonths())
                .annualGrowthRate(request.annualGrowthRate())
                .infrastructureChanges(request.infrastructureChanges())
                .confidenceLevel(request.confidenceLevel() != null
                        ? request.confidenceLevel()
                        : properties.getForecast().getDefaultConfidenceLevel())
                .applySeasonality(Boolean.TRUE.equals(request.applySeasonality()))
                .build();

        log.info("Forecast request: budget={}, months={}", forecastRequest.budgetId(), forecastRequest.months());

        Forecast forecast;
        if (request.monthlyCosts() != null && !request.monthlyCosts().isEmpty()) {
            forecast = analyticsService.projectForecast(request.monthlyCosts(), forecastRequest);
        } else {
            List<CostObservation> observations = request.observations() != null ? request.observations() : List.of();
            forecast = analyticsService.projectForecastFromObservations(observations, forecastRequest);
        }
        return ResponseEntity.ok(forecast);
    }

    @PostMapping("/trends")
    @Operation(summary = "Analyze monthly cost trends",
               description = "Trend direction, strength and month-of-year seasonal factors")
    public ResponseEntity<TrendAnalysis> analyzeTrends(@Valid @RequestBody TrendRequest request) {
        return ResponseEntity.ok(analyticsService.analyzeTrends(request.monthlyCosts()));
    }

    @PostMapping("/variance")
    @Operation(summary = "Analyze budget variance",
               description = "Compares actual spend with the budget and an optional forecast")
    public ResponseEntity<BudgetVariance> analyzeVariance(@Valid @RequestBody VarianceRequest request) {
        log.info("Variance request: budget={}", request.budgetId());
        return ResponseEntity.ok(analyticsService.analyzeVariance(
                request.forecast(), request.actualSpend(), request.budgetAmount(), request.budgetId()));
    }

    @GetMapping("/thresholds")
    @Operation(summary = "Current detection thresholds")
    public ResponseEntity<Map<String, Double>> getThresholds() {
        return ResponseEntity.ok(analyticsService.currentThresholds().toMap());
    }

    @PutMapping("/thresholds")
    @Operation(summary = "Update detection thresholds",
               description = "Partial update from snake_case names; rejected updates leave the thresholds unchanged")
    public ResponseEntity<Map<String, Double>> updateThresholds(@RequestBody Map<String, Object> values) {
        log.info("Threshold update request: {}", values.keySet());
        return ResponseEntity.ok(analyticsService.updateThresholds(values).toMap());
    }

    // Request DTOs

    public record BaselineRequest(
            @NotNull List<CostObservation> observations,
            @Min(1) Integer minPoints
    ) {}

    public record AnomalyRequest(
            @NotNull List<CostObservation> observations,
            List<ResourceCostRecord> resources,
            Map<String, Object> thresholds
    ) {}

    public record ForecastApiRequest(
            @NotBlank String budgetId,
            @Min(1) Integer months,
            Double annualGrowthRate,
            List<InfrastructureChange> infrastructureChanges,
            Double confidenceLevel,
            Boolean applySeasonality,
            List<CostObservation> observations,
            List<MonthlyCost> monthlyCosts
    ) {}

    public record TrendRequest(
            @NotNull List<MonthlyCost> monthlyCosts
    ) {}

    public record VarianceRequest(
            @NotBlank String budgetId,
            @NotNull @PositiveOrZero Double actualSpend,
            @NotNull @PositiveOrZero Double budgetAmount,
            Forecast forecast
    ) {}
}
