package com.tableedit;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.extern.java.Log;

/**
 * Structural and type checks over a parsed table. Reports problems as {@link ParseError}s
 * and never changes the rows.
 * <p>
 * Every configured check runs. Errors come out required columns first, then duplicate
 * keys, then type failures. Row numbers are reported as {@code row index + 1}.
 */
@Log
public class TableValidator {

    private final ValidationRules rules;

    public TableValidator(ValidationRules rules) {
        this.rules = rules;
    }

    public List<ParseError> validate(List<String> columns, List<Row> rows) {
        List<ParseError> errors = new ArrayList<>();
        if (rules.requiredColumns() != null) {
            errors.addAll(checkRequired(columns));
        }
        if (rules.hasKeyColumns()) {
            errors.addAll(checkUniqueKeys(rows));
        }
        if (rules.columnTypes() != null) {
            errors.addAll(checkTypes(rows));
        }
        log.fine(() -> "Validation found " + errors.size() + " errors in " + rows.size() + " rows");
        return errors;
    }

    private List<ParseError> checkRequired(List<String> columns) {
        Set<String> present = new HashSet<>(columns);
        List<ParseError> errors = new ArrayList<>();
        for (String col : rules.requiredColumns()) {
            if (!present.contains(col)) {
                errors.add(ParseError.at(ErrorKind.VALIDATION, 1, col, "Required column missing: " + col));
            }
        }
        return errors;
    }

    private List<ParseError> checkUniqueKeys(List<Row> rows) {
        List<String> keyColumns = rules.keyColumns();
        Map<List<String>, Integer> seen = new HashMap<>();
        List<ParseError> errors = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            int rowNum = i + 1;
            List<String> key = keyOf(rows.get(i), keyColumns);
            Integer first = seen.putIfAbsent(key, rowNum);
            if (first != null) {
                errors.add(ParseError.at(ErrorKind.VALIDATION, rowNum + 1, 1,
                        "Duplicate key " + formatKey(key) + " (first at row " + (first + 1) + ")"));
            }
        }
        return errors;
    }

    private List<ParseError> checkTypes(List<Row> rows) {
        List<ParseError> errors = new ArrayList<>();
        for (Map.Entry<String, ColumnType> entry : rules.columnTypes().entrySet()) {
            String col = entry.getKey();
            ColumnType type = entry.getValue();
            for (int i = 0; i < rows.size(); i++) {
                String value = rows.get(i).get(col);
                if (value.isEmpty() && !type.isText()) {
                    continue;
                }
                if (!type.accepts(value)) {
                    errors.add(ParseError.at(ErrorKind.VALIDATION, i + 2, col,
                            "Could not parse \"" + value + "\" as " + type.name()));
                }
            }
        }
        return errors;
    }

    /**
     * Key tuple of {@code row}; a column the row lacks contributes {@code null}.
     */
    static List<String> keyOf(Row row, List<String> keyColumns) {
        List<String> key = new ArrayList<>(keyColumns.size());
        for (String col : keyColumns) {
            key.add(row.values().get(col));
        }
        return key;
    }

    static String formatKey(List<String> key) {
        return key.stream()
                .map(v -> v == null ? "missing" : "\"" + v + "\"")
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
