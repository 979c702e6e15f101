package com.microsoft.costanalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Cloud Cost Analytics
 *
 * Analytical core of the cost platform: baselines, anomaly detection,
 * root cause attribution, forecasting and budget variance.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CostAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(CostAnalyticsApplication.class, args);
    }
}
