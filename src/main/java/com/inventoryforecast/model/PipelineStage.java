package com.inventoryforecast.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Stages of the per-session pipeline. Each stage except {@link #UPLOAD} consumes
 * the artifact of exactly one upstream stage.
 */
public enum PipelineStage {
    UPLOAD("upload", null),
    PREPROCESSING("preprocessing", UPLOAD),
    FEATURE_ENGINEERING("feature engineering", PREPROCESSING),
    TRAINING("training", FEATURE_ENGINEERING),
    FORECASTING("forecasting", TRAINING),
    EVALUATION("evaluation", TRAINING),
    INSIGHTS("insights", FORECASTING);

    private final String label;
    private final PipelineStage upstream;

    PipelineStage(String label, PipelineStage upstream) {
        this.label = label;
        this.upstream = upstream;
    }

    public String label() {
        return label;
    }

    public PipelineStage upstream() {
        return upstream;
    }

    /** All stages that depend on this one, directly or transitively. */
    public Set<PipelineStage> dependents() {
        Set<PipelineStage> result = EnumSet.noneOf(PipelineStage.class);
        for (PipelineStage candidate : values()) {
            for (PipelineStage up = candidate.upstream; up != null; up = up.upstream) {
                if (up == this) {
                    result.add(candidate);
                    break;
                }
            }
        }
        return result;
    }
}
