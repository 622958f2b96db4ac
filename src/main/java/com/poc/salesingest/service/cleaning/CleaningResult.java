package com.poc.salesingest.service.cleaning;

import com.poc.salesingest.dto.CleaningReport;
import com.poc.salesingest.dto.RowData;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class CleaningResult {
    private final StageResult blank;
    private final StageResult totalishSecondColumn;
    private final StageResult summary;
    private final StageResult missingBill;

    public List<RowData> getFinalRows() {
        return missingBill.getKept();
    }

    public CleaningReport toReport() {
        return new CleaningReport(
                blank.removedCount(),
                totalishSecondColumn.removedCount(),
                summary.removedCount(),
                missingBill.removedCount(),
                getFinalRows().size());
    }
}
