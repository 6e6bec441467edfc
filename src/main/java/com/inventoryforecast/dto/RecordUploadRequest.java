package com.inventoryforecast.dto;

import com.inventoryforecast.model.RawRecord;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class RecordUploadRequest {

    @NotEmpty(message = "records must not be empty")
    @Size(max = 500_000, message = "at most 500000 records per upload")
    List<RawRecord> records;
}
