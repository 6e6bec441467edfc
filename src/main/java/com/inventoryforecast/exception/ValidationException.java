package com.inventoryforecast.exception;

import com.inventoryforecast.model.PipelineStage;

public class ValidationException extends DemandForecastException {
    public ValidationException(PipelineStage stage, String message) {
        super("VALIDATION_ERROR", stage, message);
    }
}
