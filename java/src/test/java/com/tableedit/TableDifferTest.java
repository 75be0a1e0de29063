package com.tableedit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TableDifferTest {

    private static final List<String> COLUMNS = List.of("id", "name");

    private static Row row(Object id, String name) {
        return Row.of(COLUMNS, List.of(String.valueOf(id), name));
    }

    @Test
    @DisplayName("added, removed and modified rows by key")
    void diffByKey() {
        List<Row> original = List.of(row(1, "Alice"), row(2, "Bob"));
        List<Row> edited = List.of(row(1, "Alice X"), row(3, "Carol"));
        TableDiff diff = new TableDiffer(List.of("id")).diff(original, edited);

        assertEquals(List.of(row(3, "Carol")), diff.added());
        assertEquals(List.of(row(2, "Bob")), diff.removed());
        assertEquals(1, diff.modified().size());
        assertEquals(row(1, "Alice"), diff.modified().get(0).oldRow());
        assertEquals(row(1, "Alice X"), diff.modified().get(0).newRow());
        assertEquals(3, diff.changeCount());
    }

    @Test
    @DisplayName("identical tables give an empty diff")
    void noChanges() {
        List<Row> rows = List.of(row(1, "Alice"), row(2, "Bob"));
        TableDiff diff = new TableDiffer(List.of("id")).diff(rows, List.copyOf(rows));
        assertTrue(diff.isEmpty());
    }

    @Test
    @DisplayName("reordering rows is not a change")
    void reorder() {
        TableDiff diff = new TableDiffer(List.of("id"))
                .diff(List.of(row(1, "a"), row(2, "b")), List.of(row(2, "b"), row(1, "a")));
        assertTrue(diff.isEmpty());
    }

    @Test
    @DisplayName("last row wins for duplicate keys on one side")
    void lastRowWins() {
        TableDiff diff = new TableDiffer(List.of("id"))
                .diff(List.of(row(1, "a")), List.of(row(1, "first"), row(1, "a")));
        assertTrue(diff.isEmpty());
    }

    @Test
    @DisplayName("composite key")
    void compositeKey() {
        List<String> cols = List.of("a", "b", "v");
        List<Row> original = List.of(Row.of(cols, List.of("1", "x", "old")));
        List<Row> edited = List.of(Row.of(cols, List.of("1", "x", "new")), Row.of(cols, List.of("1", "y", "n")));
        TableDiff diff = new TableDiffer(List.of("a", "b")).diff(original, edited);
        assertEquals(1, diff.added().size());
        assertEquals(1, diff.modified().size());
        assertTrue(diff.removed().isEmpty());
    }

    @Test
    @DisplayName("changes keep added rows and new versions of modified rows")
    void toChanges() {
        TableDiff diff = new TableDiffer(List.of("id"))
                .diff(List.of(row(1, "Alice"), row(2, "Bob")), List.of(row(1, "Alice X"), row(3, "Carol")));
        Changes changes = diff.toChanges();
        assertEquals(List.of(row(3, "Carol")), changes.added());
        assertEquals(List.of(row(1, "Alice X")), changes.modified());
    }

    @Test
    @DisplayName("key columns are required")
    void noKeys() {
        assertThrows(IllegalArgumentException.class, () -> new TableDiffer(List.of()));
    }
}
