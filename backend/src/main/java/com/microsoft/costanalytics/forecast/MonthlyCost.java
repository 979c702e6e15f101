package com.microsoft.costanalytics.forecast;

import java.time.LocalDate;

/**
 * Total spend for one calendar month, keyed by the first day of that month.
 */
public record MonthlyCost(LocalDate month, double cost) {

    public static MonthlyCost of(int year, int month, double cost) {
        return new MonthlyCost(LocalDate.of(year, month, 1), cost);
    }
}
