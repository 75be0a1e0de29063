package com.tableedit;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens a file for interactive editing and returns once the user is done.
 */
public interface EditorLauncher {

    void edit(Path file) throws IOException, InterruptedException;
}
