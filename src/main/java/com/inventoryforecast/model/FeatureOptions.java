package com.inventoryforecast.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class FeatureOptions {
    @Builder.Default boolean createLags = true;
    @Builder.Default boolean movingAverages = true;
    @Builder.Default boolean dateFeatures = true;
    @Builder.Default boolean weatherFeatures = true;
    @Builder.Default boolean holidayFeatures = true;
    @Builder.Default boolean trendFeatures = true;

    public static FeatureOptions defaults() {
        return FeatureOptions.builder().build();
    }
}
