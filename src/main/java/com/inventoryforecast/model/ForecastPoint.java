package com.inventoryforecast.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDate;

public record ForecastPoint(
    @JsonFormat(pattern = "yyyy-MM-dd") LocalDate date,
    double point,
    double lower,
    double upper
) {
}
