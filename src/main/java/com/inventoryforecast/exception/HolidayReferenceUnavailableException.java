package com.inventoryforecast.exception;

import com.inventoryforecast.model.PipelineStage;

public class HolidayReferenceUnavailableException extends DemandForecastException {
    public HolidayReferenceUnavailableException(String message) {
        super("HOLIDAY_REFERENCE_UNAVAILABLE", PipelineStage.FEATURE_ENGINEERING, message);
    }

    public HolidayReferenceUnavailableException(Throwable cause) {
        super("HOLIDAY_REFERENCE_UNAVAILABLE", PipelineStage.FEATURE_ENGINEERING,
              "The holiday reference service is currently unavailable. Please try again later.",
              cause);
    }
}
