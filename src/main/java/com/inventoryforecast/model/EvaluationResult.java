package com.inventoryforecast.model;

import lombok.Builder;
import lombok.Value;

/**
 * Accuracy of one model on its held-out split. {@code accuracyPercentage} is
 * {@code max(0, 100 - mape)}, an approximation rather than a statistical measure.
 */
@Value
@Builder
public class EvaluationResult {
    ModelKind kind;
    double mae;
    double rmse;
    double mape;
    double r2;
    double accuracyPercentage;
    double bias;
    double maxError;
    double residualStd;
    int sampleCount;
    int mapeSampleCount;
    AccuracyBreakdown accuracy;
    ResidualDiagnostics residuals;
}
