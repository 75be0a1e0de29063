package com.tableedit;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A prepared file awaiting edits. Call {@link #finish()} once the file has been changed
 * to parse, validate and build the result.
 */
public final class PendingEdit {

    /**
     * The finish step of a session, bound to one file and one set of options.
     */
    @FunctionalInterface
    public interface FinishStep {
        EditResult finish() throws IOException;
    }

    private final Path path;
    private final FinishStep finishStep;

    PendingEdit(Path path, FinishStep finishStep) {
        this.path = path;
        this.finishStep = finishStep;
    }

    public Path path() {
        return path;
    }

    public FinishStep finishStep() {
        return finishStep;
    }

    public EditResult finish() throws IOException {
        return finishStep.finish();
    }
}
