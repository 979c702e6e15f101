package com.microsoft.costanalytics.forecast;

import com.microsoft.costanalytics.baseline.BaselineAnalysis;
import com.microsoft.costanalytics.baseline.BaselineModel;
import com.microsoft.costanalytics.statistics.TimeSeriesStatistics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Projects monthly spend forward from a baseline or a monthly history.
 *
 * PIPELINE:
 * 1. Base projection from the source, floored at 0
 * 2. Linear growth: month i scaled by 1 + annualGrowth/12 * (i+1)
 * 3. Optional seasonal scaling (monthly history with a year of data)
 * 4. Infrastructure changes added from their start month, re-floored at 0
 * 5. Confidence band from the history's coefficient of variation
 * 6. Optimistic (x0.85) and pessimistic (x1.25) scenarios
 *
 * Without usable history a constant placeholder of $1000/month is projected
 * and flagged as such in the assumptions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ForecastProjector {

    public static final double PLACEHOLDER_MONTHLY_COST = 1000.0;
    public static final double DEFAULT_MARGIN = 0.2;
    static final double OPTIMISTIC_FACTOR = 0.85;
    static final double PESSIMISTIC_FACTOR = 1.25;

    static final String SOURCE_MONTHLY_TREND = "MONTHLY_TREND";
    static final String SOURCE_HISTORICAL_MEAN = "HISTORICAL_MEAN";
    static final String SOURCE_PLACEHOLDER = "PLACEHOLDER";

    private final HistoricalTrendAnalyzer trendAnalyzer;

    /**
     * Project from an established (or partially established) baseline.
     */
    public Forecast project(BaselineAnalysis baseline, ForecastRequest request) {
        requireRequest(request);
        if (baseline == null || baseline.statistics() == null || baseline.statistics().count() == 0) {
            log.warn("No cost history for budget {}; projecting placeholder forecast", request.budgetId());
            return placeholder(request);
        }

        int months = request.months();
        double[] base = new double[months];
        String source;

        if (baseline.established() && baseline.selectedModel() != null) {
            BaselineModel model = baseline.selectedModel();
            source = model.type().name();
            switch (model.type()) {
                case LINEAR_TREND -> {
                    double lastFitted = model.lastPrediction();
                    double slope = model.parameter(BaselineModel.SLOPE);
                    for (int i = 0; i < months; i++) {
                        base[i] = lastFitted + slope * (i + 1);
                    }
                }
                case MOVING_AVERAGE -> Arrays.fill(base, model.lastPrediction());
                case PERCENTILE -> Arrays.fill(base, model.parameter(BaselineModel.P50));
                default -> throw new IllegalStateException("Unsupported baseline model: " + model.type());
            }
        } else {
            source = SOURCE_HISTORICAL_MEAN;
            Arrays.fill(base, baseline.statistics().mean());
        }

        floorAtZero(base);
        double margin = baseline.statistics().coefficientOfVariation(DEFAULT_MARGIN);
        return assemble(request, base, margin, Map.of(), false, source, false);
    }

    /**
     * Project from a monthly cost history using its OLS trend.
     */
    public Forecast project(List<MonthlyCost> history, ForecastRequest request) {
        requireRequest(request);
        List<MonthlyCost> sorted = trendAnalyzer.sortedValid(history);
        if (sorted.isEmpty()) {
            log.warn("No monthly history for budget {}; projecting placeholder forecast", request.budgetId());
            return placeholder(request);
        }

        double[] costs = sorted.stream().mapToDouble(MonthlyCost::cost).toArray();
        double slope = TimeSeriesStatistics.linearRegression(costs).slope();
        double last = costs[costs.length - 1];

        int months = request.months();
        double[] base = new double[months];
        for (int i = 0; i < months; i++) {
            base[i] = last + slope * (i + 1);
        }
        floorAtZero(base);

        TrendAnalysis trend = trendAnalyzer.analyze(sorted);
        boolean seasonal = request.applySeasonality() && trend.hasSeasonalFactors();

        double mean = TimeSeriesStatistics.mean(costs);
        double margin = costs.length < 2 || mean <= 0
                ? DEFAULT_MARGIN
                : TimeSeriesStatistics.standardDeviation(costs) / mean;

        LocalDate lastMonth = sorted.get(sorted.size() - 1).month();
        double[] seasonalScale = new double[months];
        for (int i = 0; i < months; i++) {
            seasonalScale[i] = seasonal ? trend.seasonalFactor(lastMonth.plusMonths(i + 1).getMonthValue()) : 1.0;
        }

        return assemble(request, base, margin, trend.seasonalFactors(), seasonal, SOURCE_MONTHLY_TREND, false,
                seasonalScale);
    }

    /**
     * Constant forecast used when no history is available.
     */
    public Forecast placeholder(ForecastRequest request) {
        requireRequest(request);
        double[] base = new double[request.months()];
        Arrays.fill(base, PLACEHOLDER_MONTHLY_COST);
        return assemble(request, base, DEFAULT_MARGIN, Map.of(), false, SOURCE_PLACEHOLDER, true);
    }

    private Forecast assemble(ForecastRequest request, double[] base, double margin,
                              Map<Integer, Double> seasonalFactors, boolean seasonalityApplied,
                              String source, boolean placeholder) {
        double[] noSeasonality = new double[base.length];
        Arrays.fill(noSeasonality, 1.0);
        return assemble(request, base, margin, seasonalFactors, seasonalityApplied, source, placeholder, noSeasonality);
    }

    private Forecast assemble(ForecastRequest request, double[] projection, double margin,
                              Map<Integer, Double> seasonalFactors, boolean seasonalityApplied,
                              String source, boolean placeholder, double[] seasonalScale) {
        double[] base = projection.clone();
        double monthlyGrowth = request.growthRateOrZero() / 12.0;
        for (int i = 0; i < base.length; i++) {
            base[i] = base[i] * (1 + monthlyGrowth * (i + 1)) * seasonalScale[i];
        }

        for (InfrastructureChange change : request.infrastructureChanges()) {
            for (int i = change.startMonth(); i < base.length; i++) {
                base[i] += change.monthlyCostImpact();
            }
        }
        floorAtZero(base);

        double[] lower = new double[base.length];
        double[] upper = new double[base.length];
        double[] optimistic = new double[base.length];
        double[] pessimistic = new double[base.length];
        for (int i = 0; i < base.length; i++) {
            lower[i] = Math.max(0, base[i] * (1 - margin));
            upper[i] = Math.max(lower[i], base[i] * (1 + margin));
            optimistic[i] = base[i] * OPTIMISTIC_FACTOR;
            pessimistic[i] = base[i] * PESSIMISTIC_FACTOR;
        }

        List<Double> baseList = toList(base);
        Forecast forecast = new Forecast(
                request.budgetId(),
                request.months(),
                baseList,
                new Forecast.ConfidenceInterval(toList(lower), toList(upper), request.confidenceLevel(), margin),
                new Forecast.Scenarios(baseList, toList(optimistic), toList(pessimistic)),
                new Forecast.Assumptions(
                        request.annualGrowthRate(),
                        request.infrastructureChanges(),
                        seasonalFactors,
                        seasonalityApplied,
                        source,
                        placeholder
                ),
                Instant.now()
        );

        log.info("Forecast for budget {}: {} months from {}, total ${}",
                request.budgetId(), request.months(), source, String.format("%.2f", forecast.totalBase()));
        return forecast;
    }

    private static void requireRequest(ForecastRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Forecast request is required");
        }
    }

    private static void floorAtZero(double[] values) {
        for (int i = 0; i < values.length; i++) {
            values[i] = Math.max(0, values[i]);
        }
    }

    private static List<Double> toList(double[] values) {
        return Arrays.stream(values).boxed().toList();
    }
}
