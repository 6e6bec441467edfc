package com.inventoryforecast.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Shape of the held-out residuals ({@code actual - predicted}). Residuals that
 * look like white noise leave little structure for a better model to pick up.
 */
@Value
@Builder
public class ResidualDiagnostics {
    double mean;
    double std;
    /** Correlation of the residuals with themselves at lags 1 to 7; 0 where undefined. */
    List<Double> autocorrelation;
    /** Slope of |residual| against position; positive means errors grow over the split. */
    double heteroscedasticitySlope;
    boolean whiteNoise;
    boolean meanNearZero;
}
