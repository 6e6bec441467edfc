package com.inventoryforecast.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StageStatus(PipelineStage stage, boolean present, boolean stale, String fingerprint, Instant updatedAt) {
}
