package com.tableedit;

import java.util.List;

/**
 * Result of comparing an original and an edited row set by key columns.
 */
public record TableDiff(
        List<Row> added,
        List<Row> removed,
        List<ModifiedRow> modified) implements EditPayload {

    /**
     * A row whose key exists on both sides but whose values differ.
     */
    public record ModifiedRow(Row oldRow, Row newRow) {
    }

    public TableDiff {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
        modified = List.copyOf(modified);
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && modified.isEmpty();
    }

    public int changeCount() {
        return added.size() + removed.size() + modified.size();
    }

    public Changes toChanges() {
        return new Changes(added, modified.stream().map(ModifiedRow::newRow).toList());
    }
}
