package com.inventoryforecast.dto;

import com.inventoryforecast.model.ModelKind;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class TrainRequest {
    /** Empty or missing is rejected by the trainer. */
    List<ModelKind> modelKinds;
    /** Defaults to {@code pipeline.training.default-test-fraction}. */
    Double testFraction;
}
