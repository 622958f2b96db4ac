package com.poc.salesingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SalesClassification {
    @JsonProperty("is_sales")
    private boolean sales;

    private double confidence;
}
