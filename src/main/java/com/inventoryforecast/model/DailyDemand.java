package com.inventoryforecast.model;

import java.time.LocalDate;

/**
 * Total demand of one calendar day. {@code priceLevel} is the mean scaled unit
 * price of that day's transactions, or null when the day had none.
 */
public record DailyDemand(LocalDate date, double demand, Double priceLevel) {
}
