package com.poc.salesingest.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw cell text of one sheet, rows in file order. Rows may have different lengths.
 */
public final class TabularGrid {

    public static final int PREVIEW_ROWS = 5;

    private final List<List<String>> rows;

    public TabularGrid(List<List<String>> rows) {
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            List<String> cells = new ArrayList<>(row.size());
            for (String cell : row) {
                cells.add(cell == null ? "" : cell);
            }
            copy.add(Collections.unmodifiableList(cells));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static TabularGrid of(List<List<String>> rows) {
        return new TabularGrid(rows);
    }

    public List<List<String>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public List<String> row(int index) {
        return rows.get(index);
    }

    public List<List<String>> preview() {
        return preview(PREVIEW_ROWS);
    }

    public List<List<String>> preview(int n) {
        return rows.size() <= n ? rows : rows.subList(0, n);
    }

    /**
     * Header names taken from the given row: trimmed, blank cells become {@code Col<i>}, and a
     * repeated name gets a {@code .1}, {@code .2}... suffix so each header addresses one column.
     * Returns an empty list when the index lies outside the grid.
     */
    public List<String> headersAt(int index) {
        if (index < 0 || index >= rows.size()) {
            return Collections.emptyList();
        }
        List<String> raw = rows.get(index);
        List<String> headers = new ArrayList<>(raw.size());
        Map<String, Integer> seen = new HashMap<>();
        for (int i = 0; i < raw.size(); i++) {
            String name = raw.get(i).trim();
            if (name.isEmpty()) {
                name = "Col" + i;
            }
            String unique = name;
            while (seen.containsKey(unique)) {
                int n = seen.merge(name, 1, Integer::sum);
                unique = name + "." + n;
            }
            seen.putIfAbsent(unique, 0);
            headers.add(unique);
        }
        return Collections.unmodifiableList(headers);
    }
}
