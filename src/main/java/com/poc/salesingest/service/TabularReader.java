package com.poc.salesingest.service;

import com.poc.salesingest.exception.AnalysisException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.ss.usermodel.*;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns an uploaded .csv / .xlsx / .xls file into a grid of cell text. Only the first sheet of a
 * workbook is read.
 */
@Slf4j
@Service
public class TabularReader {

    private static final char BOM = '\uFEFF';

    public TabularGrid read(byte[] content, String filename) {
        String ext = extensionOf(filename);
        if (!ext.equals(".csv") && !ext.equals(".xlsx") && !ext.equals(".xls")) {
            throw AnalysisException.formatError("unsupported file type; use .csv or .xlsx/.xls");
        }
        if (content == null || content.length == 0) {
            throw AnalysisException.formatError("empty file");
        }

        List<List<String>> rows = ext.equals(".csv") ? readCsv(content) : readWorkbook(content);
        log.debug("Read {} rows from {}", rows.size(), filename);
        return TabularGrid.of(rows);
    }

    public static String extensionOf(String filename) {
        if (filename == null) return "";
        int dotIndex = filename.lastIndexOf('.');
        return dotIndex == -1 ? "" : filename.substring(dotIndex).toLowerCase(Locale.ROOT);
    }

    private List<List<String>> readCsv(byte[] content) {
        List<List<String>> rows = new ArrayList<>();
        try (Reader reader = new InputStreamReader(new ByteArrayInputStream(content), StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT.parse(reader)) {
            for (CSVRecord record : parser) {
                List<String> cells = new ArrayList<>(record.size());
                record.forEach(cells::add);
                rows.add(cells);
            }
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            throw AnalysisException.formatError("malformed csv: " + e.getMessage(), e);
        }

        if (!rows.isEmpty() && !rows.get(0).isEmpty()) {
            List<String> first = rows.get(0);
            String cell = first.get(0);
            if (!cell.isEmpty() && cell.charAt(0) == BOM) {
                first.set(0, cell.substring(1));
            }
        }
        return rows;
    }

    private List<List<String>> readWorkbook(byte[] content) {
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            List<List<String>> rows = new ArrayList<>();
            if (workbook.getNumberOfSheets() == 0) {
                return rows;
            }
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter();

            for (int i = 0; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                List<String> cells = new ArrayList<>();
                if (row != null) {
                    int maxCells = Math.max(row.getLastCellNum(), 0);
                    for (int j = 0; j < maxCells; j++) {
                        cells.add(getCellValueAsString(row.getCell(j), formatter));
                    }
                    // Trailing blank cells carry no data
                    while (!cells.isEmpty() && cells.get(cells.size() - 1).isEmpty()) {
                        cells.remove(cells.size() - 1);
                    }
                }
                rows.add(cells);
            }
            return rows;
        } catch (IOException | RuntimeException e) {
            throw AnalysisException.formatError("unreadable spreadsheet: " + e.getMessage(), e);
        }
    }

    private String getCellValueAsString(Cell cell, DataFormatter formatter) {
        if (cell == null) return "";
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        switch (type) {
            case STRING: return cell.getStringCellValue();
            case NUMERIC:
                CellStyle style = cell.getCellStyle();
                return formatter.formatRawCellContents(cell.getNumericCellValue(), style.getDataFormat(), style.getDataFormatString());
            case BOOLEAN: return String.valueOf(cell.getBooleanCellValue()).toUpperCase(Locale.ROOT);
            default: return "";
        }
    }
}
