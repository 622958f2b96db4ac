package com.poc.salesingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SalesMetricView {
    private Long id;

    @JsonProperty("source_type")
    private String sourceType;

    @JsonRawValue
    private String payload;

    @JsonProperty("total_sales")
    private BigDecimal totalSales;

    @JsonProperty("bill_row_count")
    private Integer billRowCount;

    @JsonProperty("unique_bill_count")
    private Integer uniqueBillCount;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;
}
