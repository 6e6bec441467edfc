package com.inventoryforecast.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class EvaluationReport implements PipelineArtifact {
    Map<ModelKind, EvaluationResult> results;
    /** Best first: ascending RMSE, then MAE. */
    List<EvaluationResult> ranking;
    ModelKind bestModel;
    /** Follow-up advice derived from the best model's metrics. */
    List<String> guidance;
    String fingerprint;
    Instant evaluatedAt;
}
