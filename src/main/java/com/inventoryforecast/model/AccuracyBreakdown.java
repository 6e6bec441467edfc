package com.inventoryforecast.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AccuracyBreakdown {
    /** Share of consecutive steps where the prediction moved the same way as the actual, 0..1. */
    double directionalAccuracy;
    double peakActual;
    double peakPredicted;
    /** {@code 1 - |peakActual - peakPredicted| / peakActual}; 0 when the actual peak is 0. */
    double peakAccuracy;
    /** Percentage of rows where the actual exceeded the prediction. */
    double underForecastPercentage;
    double overForecastPercentage;
    /** Mean signed percentage error, {@code (actual - predicted) / actual}, over rows with a non-zero actual. */
    double meanPercentageBias;
}
