package com.inventoryforecast.model;

public enum ModelKind {
    LINEAR,
    TREE_ENSEMBLE,
    BOOSTED_ENSEMBLE,
    CLASSICAL_TIME_SERIES
}
