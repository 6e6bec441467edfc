package com.inventoryforecast.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class Forecast implements PipelineArtifact {
    ModelKind modelKind;
    int horizonDays;
    double confidenceLevel;
    double zScore;
    double residualStd;
    List<ForecastPoint> points;
    ForecastSummary summary;
    String sourceFingerprint;
    String fingerprint;
    Instant generatedAt;
}
