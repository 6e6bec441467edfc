package com.inventoryforecast.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AbcItem {
    String productId;
    double demandValue;
    double share;
    double cumulativeShare;
    AbcClass abcClass;
}
