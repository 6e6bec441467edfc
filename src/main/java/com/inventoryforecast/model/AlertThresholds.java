package com.inventoryforecast.model;

public record AlertThresholds(double criticalDemand, double lowDemand, double spikeDemand) {
}
