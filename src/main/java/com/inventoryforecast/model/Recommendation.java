package com.inventoryforecast.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Recommendation {
    PriorityTier priority;
    String category;
    String title;
    String description;
    String action;
    String expectedImpact;
}
