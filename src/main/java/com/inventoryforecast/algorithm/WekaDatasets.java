package com.inventoryforecast.algorithm;

import com.inventoryforecast.model.FeatureRow;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.Utils;

import java.util.ArrayList;
import java.util.List;

/** Converts feature rows into Weka's numeric datasets; the class attribute is last. */
final class WekaDatasets {

    static final String TARGET = "demand";

    private WekaDatasets() {
    }

    static Instances header(List<String> columns, int capacity) {
        ArrayList<Attribute> attributes = new ArrayList<>(columns.size() + 1);
        columns.forEach(c -> attributes.add(new Attribute(c)));
        attributes.add(new Attribute(TARGET));
        Instances instances = new Instances("daily_demand", attributes, capacity);
        instances.setClassIndex(columns.size());
        return instances;
    }

    static Instances dataset(List<FeatureRow> rows, List<String> columns) {
        Instances instances = header(columns, rows.size());
        for (FeatureRow row : rows) {
            instances.add(instance(row, columns, instances, row.getTarget()));
        }
        return instances;
    }

    /** Instance for prediction: the class value is missing. */
    static Instance unlabeled(FeatureRow row, List<String> columns, Instances header) {
        return instance(row, columns, header, Utils.missingValue());
    }

    private static Instance instance(FeatureRow row, List<String> columns, Instances header, double target) {
        double[] values = new double[columns.size() + 1];
        for (int i = 0; i < columns.size(); i++) {
            values[i] = row.feature(columns.get(i));
        }
        values[columns.size()] = target;
        Instance instance = new DenseInstance(1.0, values);
        instance.setDataset(header);
        return instance;
    }
}
