package com.tableedit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.java.Log;

/**
 * Compares an original and an edited row set by key columns.
 * <p>
 * Within one side the last row with a given key wins; duplicates are the validator's
 * business. Added and modified rows follow edited-side order, removed rows follow
 * original-side order.
 */
@Log
public class TableDiffer {

    private final List<String> keyColumns;

    public TableDiffer(List<String> keyColumns) {
        if (keyColumns == null || keyColumns.isEmpty()) {
            throw new IllegalArgumentException("At least one key column is required");
        }
        this.keyColumns = List.copyOf(keyColumns);
    }

    public TableDiff diff(List<Row> originalRows, List<Row> editedRows) {
        Map<List<String>, Row> original = index(originalRows);
        Map<List<String>, Row> edited = index(editedRows);

        List<Row> added = new ArrayList<>();
        List<TableDiff.ModifiedRow> modified = new ArrayList<>();
        for (Map.Entry<List<String>, Row> entry : edited.entrySet()) {
            Row oldRow = original.get(entry.getKey());
            if (oldRow == null) {
                added.add(entry.getValue());
            } else if (!oldRow.equals(entry.getValue())) {
                modified.add(new TableDiff.ModifiedRow(oldRow, entry.getValue()));
            }
        }

        List<Row> removed = new ArrayList<>();
        for (Map.Entry<List<String>, Row> entry : original.entrySet()) {
            if (!edited.containsKey(entry.getKey())) {
                removed.add(entry.getValue());
            }
        }

        log.fine(() -> "Diff by " + keyColumns + ": " + added.size() + " added, "
                + removed.size() + " removed, " + modified.size() + " modified");
        return new TableDiff(added, removed, modified);
    }

    public TableDiff diff(TableSource original, TableSource edited) {
        return diff(original.rows(), edited.rows());
    }

    private Map<List<String>, Row> index(List<Row> rows) {
        // last row wins, but keeps the position of the first occurrence
        Map<List<String>, Row> byKey = new LinkedHashMap<>();
        for (Row row : rows) {
            byKey.put(TableValidator.keyOf(row, keyColumns), row);
        }
        return byKey;
    }
}
