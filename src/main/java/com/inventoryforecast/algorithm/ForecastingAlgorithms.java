package com.inventoryforecast.algorithm;

import com.inventoryforecast.config.PipelineProperties;
import com.inventoryforecast.model.ModelKind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Resolves the algorithm for a model kind, configured from {@code pipeline.training}. */
@Component
@RequiredArgsConstructor
public class ForecastingAlgorithms {

    private final PipelineProperties properties;

    public ForecastingAlgorithm forKind(ModelKind kind) {
        PipelineProperties.Training training = properties.getTraining();
        return switch (kind) {
            case LINEAR -> new LinearRegressionAlgorithm();
            case TREE_ENSEMBLE -> new RandomForestAlgorithm(
                training.getForestTrees(), training.getForestMaxDepth(), training.getRandomSeed());
            case BOOSTED_ENSEMBLE -> new GradientBoostingAlgorithm(
                training.getBoostingIterations(), training.getBoostingShrinkage(),
                training.getBoostingMaxDepth(), training.getRandomSeed());
            case CLASSICAL_TIME_SERIES -> new HoltSmoothingAlgorithm();
        };
    }
}
