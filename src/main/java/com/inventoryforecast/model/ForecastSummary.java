package com.inventoryforecast.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class ForecastSummary {
    double total;
    double averageDaily;
    double peak;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate peakDate;
}
