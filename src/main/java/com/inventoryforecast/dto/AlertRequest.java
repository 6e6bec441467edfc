package com.inventoryforecast.dto;

import jakarta.validation.constraints.DecimalMin;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Omitted thresholds fall back to {@code pipeline.alerts.*}. */
@Value
@Builder
@Jacksonized
public class AlertRequest {
    @DecimalMin(value = "0.0", message = "criticalDemand must be >= 0")
    Double criticalDemand;
    @DecimalMin(value = "0.0", message = "lowDemand must be >= 0")
    Double lowDemand;
    @DecimalMin(value = "0.0", message = "spikeDemand must be >= 0")
    Double spikeDemand;
}
