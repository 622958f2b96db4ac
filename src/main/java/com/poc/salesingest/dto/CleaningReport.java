package com.poc.salesingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CleaningReport {
    @JsonProperty("dropped_blank_rows")
    private int droppedBlankRows;

    @JsonProperty("dropped_totalish_second_col")
    private int droppedTotalishRows;

    @JsonProperty("dropped_summary_rows")
    private int droppedSummaryRows;

    @JsonProperty("dropped_missing_bill_rows")
    private int droppedMissingBillRows;

    @JsonProperty("final_rows_used")
    private int finalRowsUsed;
}
