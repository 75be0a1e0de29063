package com.tableedit;

import java.util.Locale;

/**
 * What a successful edit session returns.
 */
public enum ReturnMode {
    /** The parsed table. */
    FULL,
    /** A {@link TableDiff} against the original table. */
    DIFF,
    /** Added rows and new versions of modified rows. */
    CHANGES_ONLY;

    /**
     * Accepts {@code full}, {@code diff}, {@code changes_only} (also with a dash), any case.
     */
    public static ReturnMode parse(String name) {
        String norm = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(norm);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown return mode: " + name, e);
        }
    }

    public boolean needsOriginal() {
        return this != FULL;
    }
}
