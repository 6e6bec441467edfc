package com.inventoryforecast.model;

public record InsightParameters(int leadTimeDays, double serviceLevel, double orderCost, double holdingCost) {

    public static InsightParameters defaults() {
        return new InsightParameters(7, 0.95, 50.0, 2.0);
    }
}
