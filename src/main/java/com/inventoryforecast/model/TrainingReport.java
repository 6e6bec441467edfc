package com.inventoryforecast.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class TrainingReport {
    List<ModelKind> trained;
    Map<ModelKind, String> failures;
    Map<ModelKind, String> parameters;
    SplitInfo split;
    int featureCount;
    Duration totalDuration;
}
