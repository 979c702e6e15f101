package com.microsoft.costanalytics.config;

import com.microsoft.costanalytics.anomaly.DetectionThresholds;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized settings for the analytics core ({@code cost-analytics.*}).
 */
@Data
@Validated
@ConfigurationProperties(prefix = "cost-analytics")
public class CostAnalyticsProperties {

    @Valid
    private Detection detection = new Detection();

    @Valid
    private Baseline baseline = new Baseline();

    @Valid
    private Forecast forecast = new Forecast();

    @Valid
    private Attribution attribution = new Attribution();

    @Data
    public static class Detection {

        /** Standard deviations above expected that flag a spike. */
        @DecimalMin("0.0") private double costSpikeThreshold = 3.0;

        /** Percent increase over expected that flags a spike. */
        @DecimalMin("0.0") private double percentageIncreaseThreshold = 50.0;

        /** Absolute USD increase over expected that flags a spike. */
        @DecimalMin("0.0") private double absoluteCostThreshold = 100.0;

        @DecimalMin("0.0") private double criticalThreshold = 5.0;

        @DecimalMin("0.0") private double highThreshold = 3.5;

        @DecimalMin("0.0") private double mediumThreshold = 2.0;

        public DetectionThresholds toThresholds() {
            return new DetectionThresholds(
                    costSpikeThreshold,
                    percentageIncreaseThreshold,
                    absoluteCostThreshold,
                    criticalThreshold,
                    highThreshold,
                    mediumThreshold
            );
        }
    }

    @Data
    public static class Baseline {

        /** Minimum well-formed points before a baseline counts as established. */
        @Min(1) private int minPoints = 24;
    }

    @Data
    public static class Forecast {

        @Min(1) @Max(120) private int defaultMonths = 6;

        /** Nominal confidence level recorded on forecasts, strictly between 0 and 1. */
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "1.0", inclusive = false)
        private double defaultConfidenceLevel = 0.95;
    }

    @Data
    public static class Attribution {

        /** Resources listed individually among the contributing factors. */
        @Min(0) private int topResources = 5;

        /** Half-width of the time window examined around an anomaly. */
        @Min(1) private int timeWindowHours = 24;
    }
}
