package com.inventoryforecast.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class AlertBatch {
    String sessionId;
    List<Alert> alerts;
    Map<AlertType, Integer> counts;
    Instant generatedAt;

    public boolean isEmpty() {
        return alerts.isEmpty();
    }
}
