package com.tableedit;

import java.util.List;

/**
 * Columns plus rows. Rows need not be unique.
 */
public record Table(List<String> columns, List<Row> rows) implements TableSource, EditPayload {

    public Table {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }
}
