package com.inventoryforecast.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class CleanedTable implements PipelineArtifact {
    List<CleanedRow> rows;
    PreprocessingOptions options;
    /** column name to (category value to code) */
    Map<String, Map<String, Integer>> encodings;
    Map<String, ScalingParameters> scaling;
    int inputRowCount;
    int imputedValueCount;
    int droppedMissingCount;
    int droppedOutlierCount;
    Double outlierLowerFence;
    Double outlierUpperFence;
    boolean priceAvailable;
    String fingerprint;
    Instant createdAt;

    public int size() {
        return rows.size();
    }
}
