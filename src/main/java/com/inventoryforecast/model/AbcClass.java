package com.inventoryforecast.model;

public enum AbcClass {
    A, B, C
}
