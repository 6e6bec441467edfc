package com.inventoryforecast.model;

import java.util.List;

/** A trained predictor for one model kind. */
public interface FittedModel {

    double predict(FeatureRow row);

    /** Human readable hyper-parameters, for reporting. */
    String describe();

    /**
     * Returns a model whose state also reflects {@code observed}, the rows that
     * follow the training rows in time. Models that only read feature columns
     * carry no series state and return themselves.
     */
    default FittedModel updatedWith(List<FeatureRow> observed) {
        return this;
    }
}
