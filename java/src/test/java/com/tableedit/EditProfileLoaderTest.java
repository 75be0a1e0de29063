package com.tableedit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EditProfileLoaderTest {

    private static EditProfilesFile loadResource() throws Exception {
        try (InputStream in = EditProfileLoaderTest.class.getResourceAsStream("/profiles.yaml")) {
            assertNotNull(in);
            return EditProfileLoader.load(in);
        }
    }

    @Test
    @DisplayName("named profile carries every setting")
    void namedProfile() throws Exception {
        EditProfile profile = loadResource().profile("people");
        assertEquals("nano -w", profile.editor());

        EditOptions options = profile.toEditOptions();
        assertEquals(new DelimitedFormat(";", "//", '\''), options.format());
        assertFalse(options.writeOptions().alignColumns());
        assertFalse(options.writeOptions().headerSeparator());
        assertTrue(options.writeOptions().defaultFooter());
        assertEquals(List.of("Edit people below", ""), options.writeOptions().headerComments());
        assertEquals(List.of("id", "name"), options.rules().requiredColumns());
        assertEquals(List.of("id"), options.rules().keyColumns());
        assertSame(ColumnType.INTEGER, options.rules().columnTypes().get("id"));
        assertSame(ColumnType.BOOLEAN, options.rules().columnTypes().get("active"));
        assertEquals(ReturnMode.CHANGES_ONLY, options.returnMode());
        assertNull(options.original());
        assertNull(options.destination());
    }

    @Test
    @DisplayName("no profile name selects the default profile")
    void defaultProfile() throws Exception {
        EditOptions options = loadResource().profile(null).toEditOptions();
        assertEquals(",", options.format().delimiter());
        assertEquals("#", options.format().commentPrefix());
        assertEquals(ReturnMode.FULL, options.returnMode());
        assertNull(options.rules().keyColumns());
    }

    @Test
    @DisplayName("unknown profile name is rejected")
    void unknownProfile() throws Exception {
        EditProfilesFile file = loadResource();
        assertThrows(IllegalArgumentException.class, () -> file.profile("nope"));
    }

    @Test
    @DisplayName("load from a file path; empty file has no profiles")
    void loadPath(@TempDir Path dir) throws Exception {
        Path yaml = dir.resolve("p.yaml");
        Files.writeString(yaml, "profiles:\n  csv:\n    delimiter: \",\"\n    returnMode: diff\n");
        EditProfilesFile file = EditProfileLoader.load(yaml);
        assertEquals(ReturnMode.DIFF, file.profile("csv").toEditOptions().returnMode());

        Path empty = dir.resolve("empty.yaml");
        Files.writeString(empty, "");
        assertTrue(EditProfileLoader.load(empty).getProfiles().isEmpty());
    }

    @Test
    @DisplayName("bad quote character or return mode is rejected")
    void badValues() {
        EditProfile profile = new EditProfile();
        profile.setQuoteChar("''");
        assertThrows(IllegalArgumentException.class, profile::toFormat);

        EditProfile mode = new EditProfile();
        mode.setReturnMode("everything");
        assertThrows(IllegalArgumentException.class, mode::toEditOptions);
    }
}
