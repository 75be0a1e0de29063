package com.tableedit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileFingerprintTest {

    @Test
    void changesWithContent(@TempDir Path dir) throws Exception {
        Path a = Files.writeString(dir.resolve("a"), "id\tname\n1\tAlice\n");
        Path b = Files.writeString(dir.resolve("b"), "id\tname\n1\tAlice\n");
        String before = FileFingerprint.of(a);
        assertEquals(64, before.length());
        assertEquals(before, FileFingerprint.of(b));

        Files.writeString(a, "id\tname\n1\tAlicia\n");
        assertNotEquals(before, FileFingerprint.of(a));
    }
}
