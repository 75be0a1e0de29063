package com.tableedit;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import lombok.extern.java.Log;

/**
 * Round trip of a table through a text editor, in the style of {@code git rebase -i}:
 * write the table to a file, let the user edit it, then parse, validate and
 * optionally diff the result against the original.
 */
@Log
public class EditSession {

    private final EditorLauncher launcher;

    public EditSession() {
        this(new ProcessEditorLauncher());
    }

    public EditSession(EditorLauncher launcher) {
        this.launcher = launcher;
    }

    /**
     * Writes {@code table} to {@code options.destination()}, or to a new temporary file.
     *
     * @return the path written
     */
    public Path prepare(TableSource table, EditOptions options) throws IOException {
        Path path = options.destination();
        if (path == null) {
            path = Files.createTempFile("tableedit_", ".txt");
        }
        new TableWriter(options.writeOptions()).write(table, path);
        Path written = path;
        log.fine(() -> "Prepared " + table.rows().size() + " rows in " + written);
        return path;
    }

    /**
     * Parses and validates the file at {@code path}. Any parse error fails the edit;
     * otherwise any validation error does. Parse errors hide validation errors.
     */
    public EditResult finish(Path path, EditOptions options) throws IOException {
        ParseResult parsed = new TableParser(options.format()).parse(path);
        if (!parsed.isOk()) {
            log.info(() -> "Edited file has " + parsed.errors().size() + " parse errors");
            return EditResult.failure(parsed.errors());
        }

        List<ParseError> validationErrors =
                new TableValidator(options.rules()).validate(parsed.columns(), parsed.rows());
        if (!validationErrors.isEmpty()) {
            log.info(() -> "Edited file has " + validationErrors.size() + " validation errors");
            return EditResult.failure(validationErrors);
        }

        ReturnMode mode = options.returnMode();
        if (mode == null) {
            return configurationError("No return mode given");
        }
        if (!mode.needsOriginal()) {
            return EditResult.success(parsed.toTable());
        }

        List<String> keyColumns = options.rules().keyColumns();
        if (options.original() == null || keyColumns == null || keyColumns.isEmpty()) {
            return configurationError("Return mode " + mode.name().toLowerCase(Locale.ROOT)
                    + " requires an original table and key columns");
        }
        TableDiff diff = new TableDiffer(keyColumns).diff(options.original().rows(), parsed.rows());
        log.info(() -> "Edit produced " + diff.added().size() + " added, " + diff.removed().size()
                + " removed, " + diff.modified().size() + " modified rows");
        return EditResult.success(mode == ReturnMode.DIFF ? diff : diff.toChanges());
    }

    /**
     * Prepares the file, runs the editor on it and blocks until it exits, then finishes.
     */
    public EditResult run(TableSource table, EditOptions options) throws IOException, InterruptedException {
        Path path = prepare(table, options);
        String before = FileFingerprint.of(path);
        launcher.edit(path);
        if (before.equals(FileFingerprint.of(path))) {
            log.info(() -> "No changes saved to " + path);
        }
        return finish(path, options);
    }

    /**
     * Prepares the file without launching an editor. The caller edits the file and
     * then calls {@link PendingEdit#finish()}.
     */
    public PendingEdit prepareDeferred(TableSource table, EditOptions options) throws IOException {
        Path path = prepare(table, options);
        return new PendingEdit(path, () -> finish(path, options));
    }

    static EditResult configurationError(String message) {
        return EditResult.failure(List.of(ParseError.at(ErrorKind.CONFIGURATION, 0, 1, message)));
    }
}
