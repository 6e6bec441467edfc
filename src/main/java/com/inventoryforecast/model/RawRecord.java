package com.inventoryforecast.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/** One uploaded sales transaction. Any field may be missing. */
@Value
@Builder
@Jacksonized
public class RawRecord {
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;
    String productId;
    Double quantity;
    Double unitPrice;
    String store;
    String customerSegment;
}
