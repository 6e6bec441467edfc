package com.inventoryforecast.algorithm;

import com.inventoryforecast.model.FeatureRow;
import com.inventoryforecast.model.FittedModel;
import com.inventoryforecast.model.ModelKind;
import weka.classifiers.trees.RandomForest;
import weka.core.Instances;

import java.util.List;

public class RandomForestAlgorithm implements ForecastingAlgorithm {

    private final int trees;
    private final int maxDepth;
    private final int seed;

    public RandomForestAlgorithm(int trees, int maxDepth, int seed) {
        this.trees = trees;
        this.maxDepth = maxDepth;
        this.seed = seed;
    }

    @Override
    public ModelKind kind() {
        return ModelKind.TREE_ENSEMBLE;
    }

    @Override
    public FittedModel fit(List<FeatureRow> trainRows, List<String> columns) throws Exception {
        Instances data = WekaDatasets.dataset(trainRows, columns);
        RandomForest forest = new RandomForest();
        forest.setNumIterations(trees);
        forest.setMaxDepth(maxDepth);
        forest.setSeed(seed);
        forest.setNumExecutionSlots(1);
        forest.buildClassifier(data);
        return new WekaRegressionModel(forest, data, columns, "random forest");
    }
}
