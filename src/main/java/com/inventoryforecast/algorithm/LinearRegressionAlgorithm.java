package com.inventoryforecast.algorithm;

import com.inventoryforecast.model.FeatureRow;
import com.inventoryforecast.model.FittedModel;
import com.inventoryforecast.model.ModelKind;
import weka.classifiers.functions.LinearRegression;
import weka.core.Instances;
import weka.core.SelectedTag;

import java.util.List;

/** Ordinary least squares with a negligible ridge for numerical stability. */
public class LinearRegressionAlgorithm implements ForecastingAlgorithm {

    @Override
    public ModelKind kind() {
        return ModelKind.LINEAR;
    }

    @Override
    public FittedModel fit(List<FeatureRow> trainRows, List<String> columns) throws Exception {
        Instances data = WekaDatasets.dataset(trainRows, columns);
        LinearRegression regression = new LinearRegression();
        regression.setRidge(1.0e-8);
        regression.setAttributeSelectionMethod(
            new SelectedTag(LinearRegression.SELECTION_NONE, LinearRegression.TAGS_SELECTION));
        regression.buildClassifier(data);
        return new WekaRegressionModel(regression, data, columns, "linear regression");
    }
}
