package com.microsoft.costanalytics;

import com.microsoft.costanalytics.domain.model.CostObservation;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToDoubleFunction;

/**
 * Hourly cost series shared by the analytics tests.
 */
public final class CostSeriesFixtures {

    public static final Instant START = Instant.parse("2024-03-01T00:00:00Z");
    public static final String SERVICE = "AmazonEC2";
    public static final String REGION = "us-east-1";

    private CostSeriesFixtures() {
    }

    public static List<CostObservation> hourly(int count, IntToDoubleFunction costAt) {
        List<CostObservation> series = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            series.add(CostObservation.of(hourAt(i), costAt.applyAsDouble(i), SERVICE, REGION));
        }
        return series;
    }

    public static List<CostObservation> constant(int count, double cost) {
        return hourly(count, i -> cost);
    }

    /**
     * Constant series with a single spike at {@code spikeIndex}.
     */
    public static List<CostObservation> constantWithSpike(int count, double cost, int spikeIndex, double spikeCost) {
        return hourly(count, i -> i == spikeIndex ? spikeCost : cost);
    }

    public static Instant hourAt(int index) {
        return START.plus(Duration.ofHours(index));
    }
}
