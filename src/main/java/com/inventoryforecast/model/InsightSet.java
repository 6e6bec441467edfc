package com.inventoryforecast.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class InsightSet implements PipelineArtifact {
    ModelKind modelKind;
    List<AbcItem> abcClassification;
    List<AbcSummary> abcSummary;
    InventoryPolicy policy;
    double demandTrendPercent;
    double coefficientOfVariation;
    PriorityTier volatility;
    List<Recommendation> recommendations;
    Map<PriorityTier, Integer> tierCounts;
    String fingerprint;
    Instant generatedAt;
}
