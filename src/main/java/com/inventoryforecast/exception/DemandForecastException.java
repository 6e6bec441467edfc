package com.inventoryforecast.exception;

import com.inventoryforecast.model.PipelineStage;
import lombok.Getter;

@Getter
public abstract class DemandForecastException extends RuntimeException {
    private final String errorCode;
    private final PipelineStage stage;

    protected DemandForecastException(String errorCode, PipelineStage stage, String message) {
        super(message);
        this.errorCode = errorCode;
        this.stage = stage;
    }

    protected DemandForecastException(String errorCode, PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.stage = stage;
    }
}
