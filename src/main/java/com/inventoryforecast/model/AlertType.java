package com.inventoryforecast.model;

public enum AlertType {
    CRITICAL, LOW, SPIKE, REORDER
}
