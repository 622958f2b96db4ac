package com.poc.salesingest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestionResult {
    public static final String TYPE_SALES = "sales_metrics";
    public static final String TYPE_KNOWLEDGE = "knowledge";

    private String type;

    @JsonProperty("file_name")
    private String fileName;

    private String status;
    private Metrics metrics;
    private String notes;
}
