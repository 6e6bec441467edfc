package com.inventoryforecast.dto;

import com.inventoryforecast.model.StageStatus;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PipelineStatusResponse {
    String sessionId;
    List<StageStatus> stages;
}
