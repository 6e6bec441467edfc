package com.inventoryforecast.exception;

import com.inventoryforecast.model.PipelineStage;

public class InsufficientDataException extends DemandForecastException {
    public InsufficientDataException(PipelineStage stage, String message) {
        super("INSUFFICIENT_DATA", stage, message);
    }
}
