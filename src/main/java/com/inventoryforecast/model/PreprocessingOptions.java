package com.inventoryforecast.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class PreprocessingOptions {
    @Builder.Default boolean handleMissing = true;
    @Builder.Default boolean removeOutliers = true;
    @Builder.Default boolean encodeCategorical = true;
    @Builder.Default boolean scaleFeatures = true;

    public static PreprocessingOptions defaults() {
        return PreprocessingOptions.builder().build();
    }
}
