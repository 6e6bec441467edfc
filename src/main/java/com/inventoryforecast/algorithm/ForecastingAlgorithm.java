package com.inventoryforecast.algorithm;

import com.inventoryforecast.model.FeatureRow;
import com.inventoryforecast.model.FittedModel;
import com.inventoryforecast.model.ModelKind;

import java.util.List;

/**
 * Capability of one model kind: fit to the chronologically ordered training
 * rows. Learner failures propagate unchanged so the trainer can record them.
 */
public interface ForecastingAlgorithm {

    ModelKind kind();

    FittedModel fit(List<FeatureRow> trainRows, List<String> columns) throws Exception;
}
