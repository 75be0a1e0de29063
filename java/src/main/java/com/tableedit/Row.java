package com.tableedit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One table row: column name to string value, in column order.
 * <p>
 * With duplicate column names the last value written under a name wins.
 */
public record Row(Map<String, String> values) {

    public Row {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Pairs column names with values by position. Both lists must have the same size.
     */
    public static Row of(List<String> columns, List<String> values) {
        if (columns.size() != values.size()) {
            throw new IllegalArgumentException(
                    "Expected " + columns.size() + " values, got " + values.size());
        }
        Map<String, String> data = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            data.put(columns.get(i), values.get(i));
        }
        return new Row(data);
    }

    /**
     * Value under {@code column}, or {@code ""} if the row has no such column.
     */
    public String get(String column) {
        String val = values.get(column);
        return val == null ? "" : val;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
