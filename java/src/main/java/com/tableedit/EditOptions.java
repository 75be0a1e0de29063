package com.tableedit;

import java.nio.file.Path;

/**
 * Settings for one {@link EditSession} round trip.
 *
 * @param writeOptions how the table is written; its format is also used to read it back
 * @param rules        validation of the edited table
 * @param original     table to diff against, needed for {@link ReturnMode#DIFF} and
 *                     {@link ReturnMode#CHANGES_ONLY}
 * @param returnMode   what a successful finish returns
 * @param destination  file to write, or {@code null} for a temporary file
 */
public record EditOptions(
        WriteOptions writeOptions,
        ValidationRules rules,
        TableSource original,
        ReturnMode returnMode,
        Path destination) {

    public EditOptions {
        if (writeOptions == null) {
            writeOptions = WriteOptions.defaults();
        }
        if (rules == null) {
            rules = ValidationRules.NONE;
        }
    }

    public static EditOptions defaults() {
        return new EditOptions(WriteOptions.defaults(), ValidationRules.NONE, null, ReturnMode.FULL, null);
    }

    public DelimitedFormat format() {
        return writeOptions.format();
    }

    public EditOptions withWriteOptions(WriteOptions writeOptions) {
        return new EditOptions(writeOptions, rules, original, returnMode, destination);
    }

    public EditOptions withFormat(DelimitedFormat format) {
        return withWriteOptions(writeOptions.withFormat(format));
    }

    public EditOptions withRules(ValidationRules rules) {
        return new EditOptions(writeOptions, rules, original, returnMode, destination);
    }

    public EditOptions withOriginal(TableSource original) {
        return new EditOptions(writeOptions, rules, original, returnMode, destination);
    }

    public EditOptions withReturnMode(ReturnMode returnMode) {
        return new EditOptions(writeOptions, rules, original, returnMode, destination);
    }

    public EditOptions withDestination(Path destination) {
        return new EditOptions(writeOptions, rules, original, returnMode, destination);
    }
}
