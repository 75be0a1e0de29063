package com.tableedit;

/**
 * Marker for the result carried by a successful {@link EditResult}: a {@link Table},
 * a {@link TableDiff} or a {@link Changes}, depending on the {@link ReturnMode}.
 */
public interface EditPayload {
}
