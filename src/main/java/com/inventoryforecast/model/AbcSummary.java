package com.inventoryforecast.model;

public record AbcSummary(AbcClass abcClass, int productCount, double valueShare) {
}
