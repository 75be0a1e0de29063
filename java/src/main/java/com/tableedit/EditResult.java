package com.tableedit;

import java.util.List;

/**
 * Outcome of finishing an edit. All or nothing: either {@code ok} with a result and no
 * errors, or not ok with errors and no result.
 */
public record EditResult(boolean ok, EditPayload result, List<ParseError> errors) {

    public EditResult {
        errors = List.copyOf(errors);
    }

    public static EditResult success(EditPayload result) {
        return new EditResult(true, result, List.of());
    }

    public static EditResult failure(List<ParseError> errors) {
        return new EditResult(false, null, errors);
    }

    public Table table() {
        return payload(Table.class);
    }

    public TableDiff diff() {
        return payload(TableDiff.class);
    }

    public Changes changes() {
        return payload(Changes.class);
    }

    private <T extends EditPayload> T payload(Class<T> type) {
        if (!ok) {
            throw new IllegalStateException("Edit failed with " + errors.size() + " errors");
        }
        if (!type.isInstance(result)) {
            throw new IllegalStateException("Result is a " + result.getClass().getSimpleName()
                    + ", not a " + type.getSimpleName());
        }
        return type.cast(result);
    }
}
