package com.tableedit;

import java.util.List;

/**
 * Columns, rows and errors from one parse. Rows that failed are absent; the rest are kept.
 */
public record ParseResult(List<String> columns, List<Row> rows, List<ParseError> errors) {

    public ParseResult {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
        errors = List.copyOf(errors);
    }

    public boolean isOk() {
        return errors.isEmpty();
    }

    public Table toTable() {
        return new Table(columns, rows);
    }
}
