package com.tableedit;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import lombok.extern.java.Log;

/**
 * Runs an external editor command on the file, with the caller's stdin, stdout and
 * stderr, and blocks until it exits. No timeout.
 */
@Log
public class ProcessEditorLauncher implements EditorLauncher {

    public static final String DEFAULT_EDITOR = "vi";

    private final List<String> command;

    public ProcessEditorLauncher() {
        this(null);
    }

    /**
     * @param editor command line, split on whitespace; {@code null} or blank resolves
     *               from {@code VISUAL}, then {@code EDITOR}, then {@value #DEFAULT_EDITOR}
     */
    public ProcessEditorLauncher(String editor) {
        this.command = resolveCommand(editor, System.getenv());
    }

    @Override
    public void edit(Path file) throws IOException, InterruptedException {
        List<String> cmd = new ArrayList<>(command);
        cmd.add(file.toString());
        log.info(() -> "Launching editor: " + String.join(" ", cmd));

        Process process = new ProcessBuilder(cmd).inheritIO().start();
        int status = process.waitFor();
        if (status != 0) {
            throw new IOException("Editor " + command.get(0) + " exited with status " + status);
        }
        log.fine("Editor exited normally");
    }

    static List<String> resolveCommand(String editor, Map<String, String> env) {
        String ed = editor;
        if (isBlank(ed)) {
            ed = env.get("VISUAL");
        }
        if (isBlank(ed)) {
            ed = env.get("EDITOR");
        }
        if (isBlank(ed)) {
            ed = DEFAULT_EDITOR;
        }
        return List.copyOf(Arrays.asList(ed.trim().split("\\s+")));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
