package com.inventoryforecast.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class InventoryPolicyCalculatorTest {

    @Test
    void economicOrderQuantity_roundsToNearestUnit() {
        assertThat(InventoryPolicyCalculator.economicOrderQuantity(1200, 50, 2)).isEqualTo(245L);
    }

    @Test
    void economicOrderQuantity_isZeroWithoutDemandOrOrderCost() {
        assertThat(InventoryPolicyCalculator.economicOrderQuantity(0, 50, 2)).isZero();
        assertThat(InventoryPolicyCalculator.economicOrderQuantity(1200, 0, 2)).isZero();
    }

    @Test
    void serviceLevelZ_isOneSided() {
        assertThat(InventoryPolicyCalculator.serviceLevelZ(0.95)).isCloseTo(1.645, within(0.001));
        assertThat(InventoryPolicyCalculator.serviceLevelZ(0.5)).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void safetyStockAndReorderPoint() {
        double ss = InventoryPolicyCalculator.safetyStock(2.0, 3.0, 4);

        assertThat(ss).isCloseTo(12.0, within(1e-9));
        assertThat(InventoryPolicyCalculator.reorderPoint(10.0, 4, ss)).isCloseTo(52.0, within(1e-9));
    }
}
