package com.poc.salesingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DetectionMeta {
    @JsonProperty("file_name")
    private String fileName;

    @JsonProperty("header_row")
    private int headerRow;

    @JsonProperty("sales_column")
    private String salesColumn;

    @JsonProperty("bill_column")
    private String billColumn;

    @JsonProperty("ai_used")
    private boolean aiUsed;

    @JsonProperty("ai_message")
    private String aiMessage;

    /**
     * Every detection strategy that ran, in order, with its outcome.
     */
    private List<StrategyAttempt> attempts;
}
