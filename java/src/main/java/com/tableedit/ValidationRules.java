package com.tableedit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validation applied after parsing. A {@code null} component means the check is off.
 * Column types are checked in the map's iteration order.
 */
public record ValidationRules(
        List<String> requiredColumns,
        List<String> keyColumns,
        Map<String, ColumnType> columnTypes) {

    public static final ValidationRules NONE = new ValidationRules(null, null, null);

    public ValidationRules {
        requiredColumns = requiredColumns == null ? null : List.copyOf(requiredColumns);
        keyColumns = keyColumns == null ? null : List.copyOf(keyColumns);
        columnTypes = columnTypes == null ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(columnTypes));
    }

    public ValidationRules withRequiredColumns(List<String> requiredColumns) {
        return new ValidationRules(requiredColumns, keyColumns, columnTypes);
    }

    public ValidationRules withKeyColumns(List<String> keyColumns) {
        return new ValidationRules(requiredColumns, keyColumns, columnTypes);
    }

    public ValidationRules withColumnTypes(Map<String, ColumnType> columnTypes) {
        return new ValidationRules(requiredColumns, keyColumns, columnTypes);
    }

    public boolean hasKeyColumns() {
        return keyColumns != null && !keyColumns.isEmpty();
    }
}
