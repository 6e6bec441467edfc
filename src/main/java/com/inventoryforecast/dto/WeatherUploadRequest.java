package com.inventoryforecast.dto;

import com.inventoryforecast.model.WeatherObservation;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class WeatherUploadRequest {

    @NotNull(message = "observations is required")
    List<@Valid WeatherObservation> observations;
}
