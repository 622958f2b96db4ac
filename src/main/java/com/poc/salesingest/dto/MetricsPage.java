package com.poc.salesingest.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetricsPage {
    private List<SalesMetricView> items;
    private int limit;
    private int offset;
}
