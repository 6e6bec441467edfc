package com.inventoryforecast.dto;

import com.inventoryforecast.model.InsightParameters;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class InsightRequest {
    @Builder.Default int leadTimeDays = 7;
    @Builder.Default double serviceLevel = 0.95;
    @Builder.Default double orderCost = 50.0;
    @Builder.Default double holdingCost = 2.0;

    public InsightParameters toParameters() {
        return new InsightParameters(leadTimeDays, serviceLevel, orderCost, holdingCost);
    }
}
