package com.inventoryforecast.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/** Every model produced by one training run of a session. */
@Value
@Builder
public class TrainedModelSet implements PipelineArtifact {
    Map<ModelKind, TrainedModel> models;
    TrainingReport report;
    FeatureTable features;
    String fingerprint;

    public Optional<TrainedModel> find(ModelKind kind) {
        return Optional.ofNullable(models.get(kind));
    }
}
