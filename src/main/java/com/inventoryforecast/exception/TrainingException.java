package com.inventoryforecast.exception;

import com.inventoryforecast.model.ModelKind;
import com.inventoryforecast.model.PipelineStage;
import lombok.Getter;

import java.util.Map;

@Getter
public class TrainingException extends DemandForecastException {
    private final Map<ModelKind, String> failures;

    public TrainingException(String message) {
        this(message, Map.of());
    }

    public TrainingException(String message, Map<ModelKind, String> failures) {
        super("TRAINING_ERROR", PipelineStage.TRAINING, message);
        this.failures = Map.copyOf(failures);
    }
}
