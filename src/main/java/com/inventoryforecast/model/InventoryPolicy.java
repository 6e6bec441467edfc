package com.inventoryforecast.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InventoryPolicy {
    double averageDailyDemand;
    double demandStd;
    int leadTimeDays;
    double serviceLevel;
    double zScore;
    double safetyStock;
    double reorderPoint;
    double annualDemand;
    long economicOrderQuantity;
    double ordersPerYear;
    double daysBetweenOrders;
    double annualHoldingCost;
    double annualOrderingCost;
    double totalInventoryCost;
}
