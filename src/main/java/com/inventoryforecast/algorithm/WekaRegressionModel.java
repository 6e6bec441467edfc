package com.inventoryforecast.algorithm;

import com.inventoryforecast.model.FeatureRow;
import com.inventoryforecast.model.FittedModel;
import weka.classifiers.AbstractClassifier;
import weka.core.Instances;
import weka.core.Utils;

import java.util.List;

final class WekaRegressionModel implements FittedModel {

    private final AbstractClassifier classifier;
    private final Instances header;
    private final List<String> columns;
    private final String description;

    WekaRegressionModel(AbstractClassifier classifier, Instances trainingData, List<String> columns, String description) {
        this.classifier = classifier;
        this.header = new Instances(trainingData, 0);
        this.columns = List.copyOf(columns);
        this.description = description;
    }

    @Override
    public double predict(FeatureRow row) {
        try {
            return classifier.classifyInstance(WekaDatasets.unlabeled(row, columns, header));
        } catch (Exception e) {
            throw new IllegalStateException("Prediction failed for " + row.getDate() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return description + " [" + Utils.joinOptions(classifier.getOptions()) + "]";
    }
}
