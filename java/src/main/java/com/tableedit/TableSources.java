package com.tableedit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adapters from common in-memory table shapes to {@link TableSource}. Values are turned
 * into strings with {@link String#valueOf(Object)}; {@code null} becomes the empty string.
 */
public final class TableSources {

    private TableSources() {}

    /**
     * Column-oriented: column name to its values, in column order. All columns must have
     * the same length.
     */
    public static TableSource ofColumns(Map<String, ? extends List<?>> columnData) {
        List<String> columns = new ArrayList<>(columnData.keySet());
        int nrows = -1;
        for (Map.Entry<String, ? extends List<?>> entry : columnData.entrySet()) {
            int size = entry.getValue().size();
            if (nrows >= 0 && size != nrows) {
                throw new IllegalArgumentException("Column " + entry.getKey() + " has " + size
                        + " values, expected " + nrows);
            }
            nrows = size;
        }
        List<Row> rows = new ArrayList<>();
        for (int r = 0; r < Math.max(nrows, 0); r++) {
            Map<String, String> data = new LinkedHashMap<>();
            for (String col : columns) {
                data.put(col, stringify(columnData.get(col).get(r)));
            }
            rows.add(new Row(data));
        }
        return new Table(columns, rows);
    }

    /**
     * Column names plus positional rows. Each row must have one value per column.
     */
    public static TableSource of(List<String> columns, List<? extends List<?>> rows) {
        List<Row> out = new ArrayList<>(rows.size());
        for (List<?> values : rows) {
            List<String> strings = new ArrayList<>(values.size());
            for (Object v : values) {
                strings.add(stringify(v));
            }
            out.add(Row.of(columns, strings));
        }
        return new Table(columns, out);
    }

    /**
     * Column names plus name-keyed rows. Names a row lacks read as empty; names not in
     * {@code columns} are dropped.
     */
    public static TableSource ofMaps(List<String> columns, List<? extends Map<String, ?>> rows) {
        List<Row> out = new ArrayList<>(rows.size());
        for (Map<String, ?> record : rows) {
            Map<String, String> data = new LinkedHashMap<>();
            for (String col : columns) {
                data.put(col, stringify(record.get(col)));
            }
            out.add(new Row(data));
        }
        return new Table(columns, out);
    }

    /**
     * Record sequence: the first record's key order defines the columns.
     */
    public static TableSource ofRecords(List<? extends Map<String, ?>> records) {
        if (records.isEmpty()) {
            return new Table(List.of(), List.of());
        }
        return ofMaps(new ArrayList<>(records.get(0).keySet()), records);
    }

    static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }
}
