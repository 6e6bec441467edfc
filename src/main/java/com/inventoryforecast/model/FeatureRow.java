package com.inventoryforecast.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

@Value
@Builder
public class FeatureRow {
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;
    /** Day offset from the first day of the series. */
    int dayIndex;
    double target;
    Map<String, Double> features;

    public double feature(String column) {
        Double value = features.get(column);
        return value != null ? value : 0.0;
    }
}
