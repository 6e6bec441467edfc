package com.inventoryforecast.model;

/** Declaration order is ranking order. */
public enum PriorityTier {
    HIGH, MEDIUM, LOW
}
