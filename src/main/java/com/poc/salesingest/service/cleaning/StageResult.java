package com.poc.salesingest.service.cleaning;

import com.poc.salesingest.dto.RowData;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Set;

/**
 * Output of one cleaning stage: the rows it let through and the original indices it removed.
 */
@Getter
@AllArgsConstructor
public class StageResult {
    private final List<RowData> kept;
    private final Set<Integer> removedIndices;

    public int removedCount() {
        return removedIndices.size();
    }
}
