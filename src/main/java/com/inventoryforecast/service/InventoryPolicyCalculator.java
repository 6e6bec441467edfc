package com.inventoryforecast.service;

import org.apache.commons.math3.distribution.NormalDistribution;

/** Classical inventory-control formulas. */
public final class InventoryPolicyCalculator {

    public static final int DAYS_PER_YEAR = 365;

    private InventoryPolicyCalculator() {
    }

    /** One-sided z for the probability of not stocking out, 0.95 gives about 1.645. */
    public static double serviceLevelZ(double serviceLevel) {
        return new NormalDistribution().inverseCumulativeProbability(serviceLevel);
    }

    public static double safetyStock(double z, double demandStd, int leadTimeDays) {
        return z * demandStd * Math.sqrt(leadTimeDays);
    }

    public static double reorderPoint(double averageDailyDemand, int leadTimeDays, double safetyStock) {
        return averageDailyDemand * leadTimeDays + safetyStock;
    }

    /** sqrt(2DS/H) rounded to the nearest unit; 0 when there is no demand. */
    public static long economicOrderQuantity(double annualDemand, double orderCost, double holdingCost) {
        if (annualDemand <= 0 || orderCost <= 0) {
            return 0L;
        }
        return Math.round(Math.sqrt(2.0 * annualDemand * orderCost / holdingCost));
    }
}
