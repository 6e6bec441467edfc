package com.inventoryforecast.dto;

import com.inventoryforecast.model.CleanedTable;
import com.inventoryforecast.model.PreprocessingOptions;
import com.inventoryforecast.model.ScalingParameters;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class CleanedTableSummary {
    int inputRows;
    int outputRows;
    int imputedValues;
    int droppedMissing;
    int droppedOutliers;
    Double outlierLowerFence;
    Double outlierUpperFence;
    Map<String, Map<String, Integer>> encodings;
    Map<String, ScalingParameters> scaling;
    PreprocessingOptions options;
    String fingerprint;

    public static CleanedTableSummary from(CleanedTable table) {
        return CleanedTableSummary.builder()
            .inputRows(table.getInputRowCount())
            .outputRows(table.size())
            .imputedValues(table.getImputedValueCount())
            .droppedMissing(table.getDroppedMissingCount())
            .droppedOutliers(table.getDroppedOutlierCount())
            .outlierLowerFence(table.getOutlierLowerFence())
            .outlierUpperFence(table.getOutlierUpperFence())
            .encodings(table.getEncodings())
            .scaling(table.getScaling())
            .options(table.getOptions())
            .fingerprint(table.getFingerprint())
            .build();
    }
}
