package com.inventoryforecast.model;

import java.time.LocalDate;

public record SplitInfo(int trainSize, int testSize, LocalDate lastTrainDate, LocalDate firstTestDate) {
}
