package com.microsoft.costanalytics.rootcause;

import com.microsoft.costanalytics.anomaly.Anomaly;
import com.microsoft.costanalytics.config.CostAnalyticsProperties;
import com.microsoft.costanalytics.domain.model.AnomalySeverity;
import com.microsoft.costanalytics.domain.model.CostObservation;
import com.microsoft.costanalytics.domain.model.RecommendationPriority;
import com.microsoft.costanalytics.domain.model.ResourceCostRecord;
import com.microsoft.costanalytics.statistics.TimeSeriesStatistics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Decomposes the cost delta behind an anomaly across services and resources.
 *
 * ATTRIBUTION:
 * 1. Group resources by type; each service's share of the summed increase
 * 2. Each resource's increase relative to the anomaly's absolute delta
 * 3. Factors: all services by contribution, then the top resources by increase
 * 4. Recommendations per factor plus a monitoring recommendation
 * 5. Cost behaviour in the window around the anomaly
 *
 * Without resource data only the generic investigation and monitoring
 * recommendations are produced.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RootCauseAttributor {

    static final double SERVICE_HIGH_PRIORITY_CONTRIBUTION = 50.0;
    static final double RESOURCE_HIGH_PRIORITY_CONTRIBUTION = 30.0;
    static final double WINDOW_TREND_SLOPE = 0.1;

    private static final Comparator<ServiceContribution> SERVICE_ORDER =
            Comparator.comparingDouble(ServiceContribution::contribution).reversed()
                    .thenComparing(ServiceContribution::service);

    private static final Comparator<ResourceContribution> RESOURCE_ORDER =
            Comparator.comparingDouble(ResourceContribution::costIncrease).reversed()
                    .thenComparing(ResourceContribution::resourceId);

    private final CostAnalyticsProperties properties;

    public RootCauseAnalysis attribute(Anomaly anomaly,
                                       List<ResourceCostRecord> resources,
                                       List<CostObservation> series) {
        Objects.requireNonNull(anomaly, "anomaly");
        List<ResourceCostRecord> records = usableResources(resources);

        Map<String, ServiceContribution> serviceBreakdown = analyzeServiceContributions(records);
        Map<String, ResourceContribution> resourceBreakdown =
                analyzeResourceContributions(records, Math.abs(anomaly.absoluteDelta()));

        List<ContributingFactor> factors = new ArrayList<>();
        serviceBreakdown.values().stream()
                .sorted(SERVICE_ORDER)
                .map(this::toFactor)
                .forEach(factors::add);
        resourceBreakdown.values().stream()
                .filter(resource -> resource.costIncrease() > 0)
                .sorted(RESOURCE_ORDER)
                .limit(properties.getAttribution().getTopResources())
                .map(this::toFactor)
                .forEach(factors::add);

        TimeWindowAnalysis window = analyzeTimeWindow(anomaly.timestamp(), series,
                Duration.ofHours(properties.getAttribution().getTimeWindowHours()));

        List<RootCauseRecommendation> recommendations = records.isEmpty()
                ? genericRecommendations(anomaly)
                : factorRecommendations(factors);

        log.debug("Root cause for {}: {} services, {} resources, {} factors",
                anomaly.id(), serviceBreakdown.size(), resourceBreakdown.size(), factors.size());

        return new RootCauseAnalysis(
                anomaly.id(),
                List.copyOf(factors),
                Collections.unmodifiableMap(serviceBreakdown),
                Collections.unmodifiableMap(resourceBreakdown),
                window,
                List.copyOf(recommendations)
        );
    }

    /**
     * Null and malformed resource records are logged and left out of the attribution.
     */
    List<ResourceCostRecord> usableResources(List<ResourceCostRecord> resources) {
        if (resources == null || resources.isEmpty()) {
            return List.of();
        }
        List<ResourceCostRecord> accepted = new ArrayList<>(resources.size());
        for (ResourceCostRecord resource : resources) {
            if (resource == null) {
                log.warn("Skipping null resource cost record");
                continue;
            }
            Optional<String> error = resource.validationError();
            if (error.isPresent()) {
                log.warn("Skipping malformed resource cost record {}: {}",
                        resource.resourceIdOrUnknown(), error.get());
                continue;
            }
            accepted.add(resource);
        }
        return accepted;
    }

    Map<String, ServiceContribution> analyzeServiceContributions(List<ResourceCostRecord> resources) {
        Map<String, List<ResourceCostRecord>> byService = new LinkedHashMap<>();
        for (ResourceCostRecord resource : resources) {
            byService.computeIfAbsent(resource.resourceTypeOrUnknown(), k -> new ArrayList<>()).add(resource);
        }

        double totalIncrease = 0;
        Map<String, Double> increases = new LinkedHashMap<>();
        for (Map.Entry<String, List<ResourceCostRecord>> entry : byService.entrySet()) {
            double increase = entry.getValue().stream().mapToDouble(ResourceCostRecord::costIncrease).sum();
            increases.put(entry.getKey(), increase);
            totalIncrease += increase;
        }

        Map<String, ServiceContribution> breakdown = new LinkedHashMap<>();
        for (Map.Entry<String, List<ResourceCostRecord>> entry : byService.entrySet()) {
            String service = entry.getKey();
            int count = entry.getValue().size();
            double increase = increases.get(service);
            double contribution = TimeSeriesStatistics.clamp(
                    TimeSeriesStatistics.safeDivide(increase, totalIncrease) * 100, 0, 100);
            breakdown.put(service, new ServiceContribution(
                    service, increase, count, TimeSeriesStatistics.safeDivide(increase, count), contribution));
        }
        return breakdown;
    }

    Map<String, ResourceContribution> analyzeResourceContributions(List<ResourceCostRecord> resources,
                                                                   double anomalyDelta) {
        if (anomalyDelta == 0 && !resources.isEmpty()) {
            log.debug("Anomaly delta is zero; resource contributions reported as 0");
        }
        Map<String, ResourceContribution> breakdown = new LinkedHashMap<>();
        for (ResourceCostRecord resource : resources) {
            double increase = resource.costIncrease();
            double contribution = TimeSeriesStatistics.clamp(
                    TimeSeriesStatistics.safeDivide(increase, anomalyDelta) * 100, 0, 100);
            ResourceContribution previous = breakdown.put(resource.resourceIdOrUnknown(), new ResourceContribution(
                    resource.resourceIdOrUnknown(),
                    resource.resourceTypeOrUnknown(),
                    resource.region(),
                    resource.currentCost(),
                    resource.historicalCost(),
                    increase,
                    contribution
            ));
            if (previous != null) {
                log.warn("Duplicate resource record for {}; keeping the last one", resource.resourceIdOrUnknown());
            }
        }
        return breakdown;
    }

    TimeWindowAnalysis analyzeTimeWindow(Instant anomalyTime, List<CostObservation> series, Duration halfWidth) {
        Instant start = anomalyTime.minus(halfWidth);
        Instant end = anomalyTime.plus(halfWidth);
        if (series == null) {
            return TimeWindowAnalysis.empty(start, end);
        }

        double[] costs = series.stream()
                .filter(Objects::nonNull)
                .filter(CostObservation::isWellFormed)
                .filter(o -> !o.timestamp().isBefore(start) && !o.timestamp().isAfter(end))
                .sorted()
                .mapToDouble(CostObservation::cost)
                .toArray();
        if (costs.length == 0) {
            return TimeWindowAnalysis.empty(start, end);
        }

        double mean = TimeSeriesStatistics.mean(costs);
        double stdDev = TimeSeriesStatistics.standardDeviation(costs);
        double volatility = costs.length > 1 && mean > 0 ? stdDev / mean : 0.0;

        double slope = 0.0;
        TimeWindowAnalysis.WindowTrend trend;
        if (costs.length < 2) {
            trend = TimeWindowAnalysis.WindowTrend.INSUFFICIENT_DATA;
        } else {
            slope = TimeSeriesStatistics.linearRegression(costs).slope();
            if (slope > WINDOW_TREND_SLOPE) {
                trend = TimeWindowAnalysis.WindowTrend.INCREASING;
            } else if (slope < -WINDOW_TREND_SLOPE) {
                trend = TimeWindowAnalysis.WindowTrend.DECREASING;
            } else {
                trend = TimeWindowAnalysis.WindowTrend.STABLE;
            }
        }

        return new TimeWindowAnalysis(
                start,
                end,
                costs.length,
                TimeSeriesStatistics.min(costs),
                TimeSeriesStatistics.max(costs),
                mean,
                TimeSeriesStatistics.median(costs),
                stdDev,
                volatility,
                slope,
                trend
        );
    }

    private ContributingFactor toFactor(ServiceContribution service) {
        return new ContributingFactor(
                ContributingFactor.ContributorType.SERVICE,
                service.service(),
                null,
                service.service(),
                service.contribution(),
                service.costIncrease(),
                String.format(Locale.ROOT, "Service %s contributed %.1f%% to the anomaly", service.service(), service.contribution())
        );
    }

    private ContributingFactor toFactor(ResourceContribution resource) {
        return new ContributingFactor(
                ContributingFactor.ContributorType.RESOURCE,
                resource.resourceId(),
                resource.resourceId(),
                resource.resourceType(),
                resource.contribution(),
                resource.costIncrease(),
                String.format(Locale.ROOT, "Resource %s contributed %.1f%% to the anomaly", resource.resourceId(), resource.contribution())
        );
    }

    private List<RootCauseRecommendation> factorRecommendations(List<ContributingFactor> factors) {
        List<RootCauseRecommendation> recommendations = new ArrayList<>();
        for (ContributingFactor factor : factors) {
            if (factor.type() == ContributingFactor.ContributorType.SERVICE) {
                recommendations.add(new RootCauseRecommendation(
                        RootCauseRecommendation.RecommendationType.SERVICE_INVESTIGATION,
                        factor.contribution() > SERVICE_HIGH_PRIORITY_CONTRIBUTION
                                ? RecommendationPriority.HIGH : RecommendationPriority.MEDIUM,
                        "Investigate " + factor.name() + " service cost increase",
                        String.format(Locale.ROOT, "Service %s contributed %.1f%% to the cost anomaly",
                                factor.name(), factor.contribution()),
                        "Review " + factor.name() + " resource usage and configuration changes",
                        factor.name()
                ));
            } else {
                recommendations.add(new RootCauseRecommendation(
                        RootCauseRecommendation.RecommendationType.RESOURCE_INVESTIGATION,
                        factor.contribution() > RESOURCE_HIGH_PRIORITY_CONTRIBUTION
                                ? RecommendationPriority.HIGH : RecommendationPriority.MEDIUM,
                        "Investigate resource " + factor.resourceId(),
                        String.format(Locale.ROOT, "Resource %s (%s) contributed %.1f%% to the cost anomaly",
                                factor.resourceId(), factor.resourceType(), factor.contribution()),
                        "Review resource " + factor.resourceId() + " configuration and usage patterns",
                        factor.resourceId()
                ));
            }
        }
        recommendations.add(monitoringRecommendation());
        return recommendations;
    }

    private List<RootCauseRecommendation> genericRecommendations(Anomaly anomaly) {
        RecommendationPriority priority = anomaly.severity().isAtLeast(AnomalySeverity.HIGH)
                ? RecommendationPriority.HIGH
                : RecommendationPriority.LOW;
        RootCauseRecommendation investigation = new RootCauseRecommendation(
                RootCauseRecommendation.RecommendationType.GENERAL_INVESTIGATION,
                priority,
                "Investigate cost anomaly",
                String.format(Locale.ROOT, "Cost reached $%.2f against an expected $%.2f; no resource-level data was supplied",
                        anomaly.actualCost(), anomaly.expectedCost()),
                "Review recent deployments and scaling events"
                        + (anomaly.region() != null ? " in " + anomaly.region() : ""),
                anomaly.service()
        );
        return List.of(investigation, monitoringRecommendation());
    }

    private RootCauseRecommendation monitoringRecommendation() {
        return new RootCauseRecommendation(
                RootCauseRecommendation.RecommendationType.MONITORING,
                RecommendationPriority.MEDIUM,
                "Enhance cost monitoring",
                "Set up more granular cost monitoring to detect similar anomalies earlier",
                "Configure cost alarms and budget alerts for affected services",
                null
        );
    }
}
