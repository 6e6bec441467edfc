package com.inventoryforecast.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDate;

public record Alert(
    AlertType type,
    @JsonFormat(pattern = "yyyy-MM-dd") LocalDate date,
    double value,
    double threshold,
    String message
) {
}
