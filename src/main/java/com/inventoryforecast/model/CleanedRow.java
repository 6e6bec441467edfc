package com.inventoryforecast.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class CleanedRow {
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;
    String productId;
    int productCode;
    int storeCode;
    int segmentCode;
    double quantity;
    /** Null when the upload carried no price column. */
    Double unitPrice;
    Double scaledUnitPrice;
}
