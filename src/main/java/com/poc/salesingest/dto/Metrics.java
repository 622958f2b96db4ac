package com.poc.salesingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Metrics {
    @JsonProperty("total_sales")
    private BigDecimal totalSales;

    @JsonProperty("bill_row_count")
    private int billRowCount;

    @JsonProperty("unique_bill_count")
    private int uniqueBillCount;
}
