package com.inventoryforecast.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class TrainedModel {
    ModelKind kind;
    @JsonIgnore
    FittedModel predictor;
    List<String> featureColumns;
    SplitInfo split;
    Duration trainingDuration;
    double residualStd;
    List<Double> testActuals;
    List<Double> testPredictions;
    String sourceFingerprint;
    Instant trainedAt;
}
