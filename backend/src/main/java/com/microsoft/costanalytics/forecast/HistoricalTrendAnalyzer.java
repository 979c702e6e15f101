package com.microsoft.costanalytics.forecast;

import com.microsoft.costanalytics.statistics.TimeSeriesStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Trend and seasonality analysis over monthly cost history.
 *
 * DIRECTION:
 * OLS slope per month; |slope| below 0.01 is STABLE.
 *
 * CONFIDENCE:
 * HIGH when r-squared &gt; 0.7, MEDIUM when &gt; 0.4, LOW otherwise.
 *
 * SEASONALITY:
 * Needs at least a year of history. Each calendar month's factor is its
 * mean cost over the overall mean.
 */
@Service
@Slf4j
public class HistoricalTrendAnalyzer {

    static final int MINIMUM_DATA_POINTS = 3;
    static final int SEASONAL_MINIMUM_POINTS = 12;
    static final double STABLE_SLOPE = 0.01;

    public TrendAnalysis analyze(List<MonthlyCost> history) {
        List<MonthlyCost> sorted = sortedValid(history);
        if (sorted.size() < MINIMUM_DATA_POINTS) {
            log.debug("Trend analysis skipped: {} monthly points", sorted.size());
            return TrendAnalysis.insufficientData(sorted.size());
        }

        double[] costs = sorted.stream().mapToDouble(MonthlyCost::cost).toArray();
        TimeSeriesStatistics.LinearFit fit = TimeSeriesStatistics.linearRegression(costs);

        TrendAnalysis.TrendDirection direction;
        if (Math.abs(fit.slope()) < STABLE_SLOPE) {
            direction = TrendAnalysis.TrendDirection.STABLE;
        } else if (fit.slope() > 0) {
            direction = TrendAnalysis.TrendDirection.INCREASING;
        } else {
            direction = TrendAnalysis.TrendDirection.DECREASING;
        }

        TrendAnalysis.TrendConfidence confidence;
        if (fit.rSquared() > 0.7) {
            confidence = TrendAnalysis.TrendConfidence.HIGH;
        } else if (fit.rSquared() > 0.4) {
            confidence = TrendAnalysis.TrendConfidence.MEDIUM;
        } else {
            confidence = TrendAnalysis.TrendConfidence.LOW;
        }

        Map<Integer, Double> seasonalFactors = seasonalFactors(sorted, costs);

        log.info("Trend over {} months: {} (slope={}, r2={})",
                costs.length, direction,
                String.format("%.2f", fit.slope()),
                String.format("%.2f", fit.rSquared()));

        return new TrendAnalysis(direction, fit.slope(), fit.rSquared(), confidence, seasonalFactors, costs.length);
    }

    /**
     * Valid points ordered by month. Points without a month or with a
     * negative or non-finite cost are dropped.
     */
    List<MonthlyCost> sortedValid(List<MonthlyCost> history) {
        if (history == null) {
            return List.of();
        }
        List<MonthlyCost> valid = new ArrayList<>();
        for (MonthlyCost point : history) {
            if (point == null || point.month() == null
                    || Double.isNaN(point.cost()) || Double.isInfinite(point.cost()) || point.cost() < 0) {
                log.warn("Skipping malformed monthly cost: {}", point);
                continue;
            }
            valid.add(point);
        }
        valid.sort(Comparator.comparing(MonthlyCost::month));
        return valid;
    }

    private Map<Integer, Double> seasonalFactors(List<MonthlyCost> sorted, double[] costs) {
        if (costs.length < SEASONAL_MINIMUM_POINTS) {
            return Map.of();
        }
        double overallMean = TimeSeriesStatistics.mean(costs);

        Map<Integer, List<Double>> byMonth = new TreeMap<>();
        for (MonthlyCost point : sorted) {
            byMonth.computeIfAbsent(point.month().getMonthValue(), k -> new ArrayList<>()).add(point.cost());
        }

        Map<Integer, Double> factors = new TreeMap<>();
        byMonth.forEach((month, values) -> {
            double monthMean = TimeSeriesStatistics.mean(TimeSeriesStatistics.toArray(values));
            factors.put(month, overallMean > 0 ? monthMean / overallMean : 1.0);
        });
        return factors;
    }
}
