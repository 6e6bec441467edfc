package com.inventoryforecast.dto;

import com.inventoryforecast.model.ModelKind;
import com.inventoryforecast.model.SplitInfo;
import com.inventoryforecast.model.TrainedModelSet;
import lombok.Builder;
import lombok.Value;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class TrainingResponse {
    List<ModelKind> trained;
    Map<ModelKind, String> failures;
    Map<ModelKind, String> parameters;
    Map<ModelKind, Double> residualStd;
    SplitInfo split;
    int featureCount;
    long durationMs;
    String fingerprint;

    public static TrainingResponse from(TrainedModelSet set) {
        Map<ModelKind, Double> residuals = new EnumMap<>(ModelKind.class);
        set.getModels().forEach((kind, model) -> residuals.put(kind, model.getResidualStd()));
        return TrainingResponse.builder()
            .trained(set.getReport().getTrained())
            .failures(set.getReport().getFailures())
            .parameters(set.getReport().getParameters())
            .residualStd(residuals)
            .split(set.getReport().getSplit())
            .featureCount(set.getReport().getFeatureCount())
            .durationMs(set.getReport().getTotalDuration().toMillis())
            .fingerprint(set.getFingerprint())
            .build();
    }
}
