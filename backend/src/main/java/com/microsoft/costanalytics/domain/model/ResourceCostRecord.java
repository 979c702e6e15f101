package com.microsoft.costanalytics.domain.model;

import java.util.Optional;

/**
 * Current vs. historical cost of one resource, as reported by the scanners.
 *
 * Used only for root cause attribution. A missing historical average means
 * the resource has no history yet and is treated as unchanged.
 */
public record ResourceCostRecord(
        String resourceId,
        String resourceType,
        String region,
        double currentCost,
        Double historicalAverageCost
) {

    /**
     * Describes why this record cannot be used for attribution.
     *
     * @return the reason, or empty when both costs are finite and non-negative
     */
    public Optional<String> validationError() {
        if (!Double.isFinite(currentCost) || currentCost < 0) {
            return Optional.of("invalid current cost " + currentCost);
        }
        if (historicalAverageCost != null
                && (!Double.isFinite(historicalAverageCost) || historicalAverageCost < 0)) {
            return Optional.of("invalid historical average cost " + historicalAverageCost);
        }
        return Optional.empty();
    }

    public double historicalCost() {
        return historicalAverageCost != null ? historicalAverageCost : currentCost;
    }

    /**
     * Positive part of the change between historical and current cost.
     */
    public double costIncrease() {
        double increase = currentCost - historicalCost();
        if (Double.isNaN(increase)) {
            return 0.0;
        }
        return Math.max(0.0, increase);
    }

    public String resourceTypeOrUnknown() {
        return resourceType != null && !resourceType.isBlank() ? resourceType : "unknown";
    }

    public String resourceIdOrUnknown() {
        return resourceId != null && !resourceId.isBlank() ? resourceId : "unknown";
    }
}
