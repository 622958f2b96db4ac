package com.poc.salesingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class SalesTextRequest {
    @JsonProperty("total_sales")
    private Double totalSales;

    @JsonProperty("bill_row_count")
    private Integer billRowCount;

    @JsonProperty("unique_bill_count")
    private Integer uniqueBillCount;

    private String text;
}
