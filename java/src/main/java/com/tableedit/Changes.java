package com.tableedit;

import java.util.List;

/**
 * New data only: rows added by the edit and the new versions of modified rows.
 */
public record Changes(List<Row> added, List<Row> modified) implements EditPayload {

    public Changes {
        added = List.copyOf(added);
        modified = List.copyOf(modified);
    }
}
