package com.inventoryforecast.model;

/** Fitted z-score transform for one numeric column. */
public record ScalingParameters(double mean, double std) {

    public double transform(double value) {
        return (value - mean) / std;
    }
}
