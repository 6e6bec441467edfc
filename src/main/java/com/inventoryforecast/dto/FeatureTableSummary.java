package com.inventoryforecast.dto;

import com.inventoryforecast.model.FeatureOptions;
import com.inventoryforecast.model.FeatureTable;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class FeatureTableSummary {
    int historyDays;
    int rows;
    int droppedRows;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate firstDate;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate lastDate;
    List<String> columns;
    FeatureOptions options;
    String sourceFingerprint;
    String fingerprint;

    public static FeatureTableSummary from(FeatureTable table) {
        return FeatureTableSummary.builder()
            .historyDays(table.getHistory().size())
            .rows(table.size())
            .droppedRows(table.getDroppedRowCount())
            .firstDate(table.getRows().get(0).getDate())
            .lastDate(table.getRows().get(table.size() - 1).getDate())
            .columns(table.getColumns())
            .options(table.getOptions())
            .sourceFingerprint(table.getSourceFingerprint())
            .fingerprint(table.getFingerprint())
            .build();
    }
}
