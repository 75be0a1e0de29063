package com.tableedit;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.Blake3;

/**
 * BLAKE3 digest of a file's bytes, used to tell whether the user saved any change.
 */
public final class FileFingerprint {

    private static final int HASH_LEN = 32;

    private FileFingerprint() {}

    public static String of(Path file) throws IOException {
        Blake3 hasher = Blake3.initHash();
        byte[] buf = new byte[8192];
        try (InputStream in = Files.newInputStream(file)) {
            int n;
            while ((n = in.read(buf)) > 0) {
                hasher.update(buf, 0, n);
            }
        }
        return Hex.encodeHexString(hasher.doFinalize(HASH_LEN));
    }
}
