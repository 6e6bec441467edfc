package com.inventoryforecast.exception;

import com.inventoryforecast.model.PipelineStage;

public class ArtifactNotFoundException extends DemandForecastException {
    public ArtifactNotFoundException(PipelineStage stage, String message) {
        super("NOT_FOUND", stage, message);
    }

    public static ArtifactNotFoundException missing(String sessionId, PipelineStage stage) {
        return new ArtifactNotFoundException(stage,
            "No " + stage.label() + " result for session '" + sessionId + "'. Run " + stage.label() + " first.");
    }

    public static ArtifactNotFoundException stale(String sessionId, PipelineStage stage) {
        return new ArtifactNotFoundException(stage,
            "The " + stage.label() + " result for session '" + sessionId
                + "' is stale because an upstream stage was re-run. Run " + stage.label() + " again.");
    }
}
