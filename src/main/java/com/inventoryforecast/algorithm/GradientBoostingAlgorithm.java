package com.inventoryforecast.algorithm;

import com.inventoryforecast.model.FeatureRow;
import com.inventoryforecast.model.FittedModel;
import com.inventoryforecast.model.ModelKind;
import weka.classifiers.meta.AdditiveRegression;
import weka.classifiers.trees.REPTree;
import weka.core.Instances;

import java.util.List;

/**
 * Stage-wise additive regression over shallow regression trees, i.e. gradient
 * boosting for squared loss.
 */
public class GradientBoostingAlgorithm implements ForecastingAlgorithm {

    private final int iterations;
    private final double shrinkage;
    private final int maxDepth;
    private final int seed;

    public GradientBoostingAlgorithm(int iterations, double shrinkage, int maxDepth, int seed) {
        this.iterations = iterations;
        this.shrinkage = shrinkage;
        this.maxDepth = maxDepth;
        this.seed = seed;
    }

    @Override
    public ModelKind kind() {
        return ModelKind.BOOSTED_ENSEMBLE;
    }

    @Override
    public FittedModel fit(List<FeatureRow> trainRows, List<String> columns) throws Exception {
        Instances data = WekaDatasets.dataset(trainRows, columns);
        REPTree tree = new REPTree();
        tree.setMaxDepth(maxDepth);
        tree.setMinNum(2);
        tree.setNoPruning(true);
        tree.setSeed(seed);
        AdditiveRegression boosting = new AdditiveRegression(tree);
        boosting.setNumIterations(iterations);
        boosting.setShrinkage(shrinkage);
        boosting.buildClassifier(data);
        return new WekaRegressionModel(boosting, data, columns, "gradient boosting");
    }
}
