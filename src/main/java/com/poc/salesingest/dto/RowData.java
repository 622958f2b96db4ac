package com.poc.salesingest.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RowData {
    /**
     * The row number in the original uploaded grid (0-based, header row included in the count).
     * Cleaning stages report removed rows by this index.
     */
    private int originalRowIndex;

    /**
     * Key: Header name
     * Value: Trimmed cell text ("" for missing cells)
     * Iteration order follows the header order.
     */
    private Map<String, String> cellValues;

    public String get(String header) {
        String value = cellValues.get(header);
        return value == null ? "" : value;
    }
}
