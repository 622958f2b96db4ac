package com.poc.salesingest.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ColumnMapping {
    private int headerRowIndex;
    private String salesColumn;
    private String billColumn;
}
