package com.poc.salesingest.service.cleaning;

import com.poc.salesingest.dto.RowData;
import com.poc.salesingest.service.NumericParser;
import com.poc.salesingest.service.TabularGrid;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Removes blank, subtotal and summary rows, then keeps only rows that carry a bill number.
 * Stages run in a fixed order and each one only sees what the previous stage kept.
 */
@Component
public class RowCleaningPipeline {

    private final int sparseMaxOtherFields;

    public RowCleaningPipeline(@Value("${sales.cleaning.sparse-max-other-fields:1}") int sparseMaxOtherFields) {
        this.sparseMaxOtherFields = sparseMaxOtherFields;
    }

    /**
     * One record per grid row after the header row, keyed by header. Missing cells read as "",
     * cells beyond the last header are ignored.
     */
    public static List<RowData> buildRecords(TabularGrid grid, int headerIdx, List<String> headers) {
        List<RowData> records = new ArrayList<>(Math.max(grid.rowCount() - headerIdx - 1, 0));
        for (int i = headerIdx + 1; i < grid.rowCount(); i++) {
            List<String> row = grid.row(i);
            Map<String, String> cells = new LinkedHashMap<>();
            for (int j = 0; j < headers.size(); j++) {
                cells.put(headers.get(j), j < row.size() ? row.get(j).trim() : "");
            }
            records.add(new RowData(i, cells));
        }
        return records;
    }

    public CleaningResult clean(List<RowData> records, List<String> headers, String salesCol, String billCol) {
        StageResult blank = dropBlankRows(records);
        StageResult second = dropIfSecondColumnTotalish(blank.getKept(), headers);
        StageResult summary = filterSummaryRows(second.getKept(), salesCol, billCol);
        StageResult usable = keepRowsWithBill(summary.getKept(), billCol);
        return new CleaningResult(blank, second, summary, usable);
    }

    StageResult dropBlankRows(List<RowData> rows) {
        return partition(rows, row -> row.getCellValues().values().stream().allMatch(v -> v.trim().isEmpty()));
    }

    /**
     * Some exports put a literal "Total" label in the second column of subtotal lines.
     */
    StageResult dropIfSecondColumnTotalish(List<RowData> rows, List<String> headers) {
        if (headers.size() < 2) {
            return new StageResult(rows, new LinkedHashSet<>());
        }
        String second = headers.get(1);
        return partition(rows, row -> TotalishMatcher.looksLikeTotal(row.get(second)));
    }

    StageResult filterSummaryRows(List<RowData> rows, String salesCol, String billCol) {
        return partition(rows, row -> rowIsTotalish(row) || isSparseSummary(row, salesCol, billCol));
    }

    StageResult keepRowsWithBill(List<RowData> rows, String billCol) {
        return partition(rows, row -> BillIdentifiers.isEffectivelyEmpty(row.get(billCol)));
    }

    private boolean rowIsTotalish(RowData row) {
        for (String value : row.getCellValues().values()) {
            if (TotalishMatcher.looksLikeTotal(value)) {
                return true;
            }
        }
        return false;
    }

    /**
     * No bill number, a numeric amount and almost nothing else: a trailing total line.
     */
    private boolean isSparseSummary(RowData row, String salesCol, String billCol) {
        if (!BillIdentifiers.isEffectivelyEmpty(row.get(billCol)) || !NumericParser.isNumeric(row.get(salesCol))) {
            return false;
        }
        int nonSalesNonEmpty = 0;
        for (Map.Entry<String, String> cell : row.getCellValues().entrySet()) {
            if (cell.getKey().equals(salesCol)) {
                continue;
            }
            String v = cell.getValue().trim();
            if (!v.isEmpty() && !v.toLowerCase(Locale.ROOT).equals("nan")) {
                nonSalesNonEmpty++;
            }
        }
        return nonSalesNonEmpty <= sparseMaxOtherFields;
    }

    private static StageResult partition(List<RowData> rows, Predicate<RowData> drop) {
        List<RowData> kept = new ArrayList<>(rows.size());
        Set<Integer> removed = new LinkedHashSet<>();
        for (RowData row : rows) {
            if (drop.test(row)) {
                removed.add(row.getOriginalRowIndex());
            } else {
                kept.add(row);
            }
        }
        return new StageResult(kept, removed);
    }
}
