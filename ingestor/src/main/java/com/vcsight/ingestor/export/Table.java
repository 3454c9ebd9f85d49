package com.vcsight.ingestor.export;

import com.vcsight.ingestor.transform.TabularRow;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rows of one export group, flattened to named columns.
 *
 * @param sheetName worksheet name used by the spreadsheet encoding
 */
public record Table(String sheetName, List<String> columns, List<Map<String, Object>> rows) {

    public static Table of(String sheetName, List<? extends TabularRow> records) {
        List<Map<String, Object>> rows = records.stream().map(TabularRow::toColumns).toList();
        List<String> columns = rows.isEmpty() ? List.of() : new ArrayList<>(rows.get(0).keySet());
        return new Table(sheetName, columns, rows);
    }
}
