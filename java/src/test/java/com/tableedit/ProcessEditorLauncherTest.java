package com.tableedit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProcessEditorLauncherTest {

    @Test
    @DisplayName("explicit editor wins, then VISUAL, then EDITOR, then vi")
    void resolution() {
        Map<String, String> env = Map.of("VISUAL", "code --wait", "EDITOR", "nano");
        assertEquals(List.of("emacs", "-nw"), ProcessEditorLauncher.resolveCommand("emacs  -nw", env));
        assertEquals(List.of("code", "--wait"), ProcessEditorLauncher.resolveCommand(null, env));
        assertEquals(List.of("nano"), ProcessEditorLauncher.resolveCommand(" ", Map.of("EDITOR", "nano")));
        assertEquals(List.of("vi"), ProcessEditorLauncher.resolveCommand(null, Map.of()));
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    @DisplayName("zero exit status returns normally")
    void success(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("t.tsv"), "a\n");
        new ProcessEditorLauncher("true").edit(file);
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    @DisplayName("non-zero exit status fails")
    void failure(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("t.tsv"), "a\n");
        IOException e = assertThrows(IOException.class, () -> new ProcessEditorLauncher("false").edit(file));
        assertTrue(e.getMessage().contains("status 1"));
    }
}
