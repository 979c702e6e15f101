package com.microsoft.costanalytics.domain.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;

/**
 * A single time-stamped cost observation for a cloud service.
 *
 * Observations are produced by the resource scanners upstream and handed to
 * the analytics core as-is. The record itself does not reject bad values so
 * that a batch can be sanitized record by record; see {@link #validationError()}.
 * An unparseable timestamp is read as null for the same reason.
 *
 * @param timestamp  observation time (UTC)
 * @param cost       cost in USD for the observation period, must be present and &gt;= 0
 * @param service    billing service or resource type the cost belongs to
 * @param region     provider-native region name
 * @param resourceId optional provider-native resource identifier
 */
public record CostObservation(
        @JsonDeserialize(using = LenientInstantDeserializer.class) Instant timestamp,
        Double cost,
        String service,
        String region,
        String resourceId
) implements Comparable<CostObservation> {

    private static final Comparator<CostObservation> BY_TIMESTAMP =
            Comparator.comparing(CostObservation::timestamp, Comparator.nullsLast(Comparator.naturalOrder()));

    public static CostObservation of(Instant timestamp, double cost, String service, String region) {
        return new CostObservation(timestamp, cost, service, region, null);
    }

    /**
     * Describes why this observation cannot be used for analysis.
     *
     * @return the reason, or empty when the observation is well-formed
     */
    public Optional<String> validationError() {
        if (timestamp == null) {
            return Optional.of("missing timestamp");
        }
        if (cost == null) {
            return Optional.of("missing cost");
        }
        if (Double.isNaN(cost) || Double.isInfinite(cost)) {
            return Optional.of("non-numeric cost " + cost);
        }
        if (cost < 0) {
            return Optional.of("negative cost " + cost);
        }
        return Optional.empty();
    }

    public boolean isWellFormed() {
        return validationError().isEmpty();
    }

    @Override
    public int compareTo(CostObservation other) {
        return BY_TIMESTAMP.compare(this, other);
    }
}
