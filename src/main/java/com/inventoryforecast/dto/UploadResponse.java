package com.inventoryforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class UploadResponse {
    String sessionId;
    int count;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant uploadedAt;
}
