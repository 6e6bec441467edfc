package com.inventoryforecast.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class FeatureTable implements PipelineArtifact {
    List<FeatureRow> rows;
    List<String> columns;
    /** Full daily series, including days dropped from {@code rows} for lack of history. */
    List<DailyDemand> history;
    FeatureOptions options;
    List<Integer> lags;
    List<Integer> windows;
    int droppedRowCount;
    String sourceFingerprint;
    String fingerprint;
    Instant createdAt;

    public int size() {
        return rows.size();
    }
}
