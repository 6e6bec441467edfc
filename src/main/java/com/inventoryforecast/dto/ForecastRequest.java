package com.inventoryforecast.dto;

import com.inventoryforecast.model.ModelKind;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ForecastRequest {

    @NotNull(message = "modelKind is required")
    ModelKind modelKind;

    @Builder.Default
    int horizonDays = 30;
}
