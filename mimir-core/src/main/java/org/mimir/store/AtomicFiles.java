package org.mimir.store;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Write-to-temp-then-rename helpers. Temp files live next to the destination so the rename
 * stays on one filesystem; readers never observe a partially written file.
 */
final class AtomicFiles {

    static final String TMP_PREFIX = "mimir-";
    static final String TMP_SUFFIX = ".tmp";

    private AtomicFiles() {}

    static void write(Path dst, byte[] bytes) throws IOException {
        Files.createDirectories(dst.getParent());
        Path tmp = Files.createTempFile(dst.getParent(), TMP_PREFIX, TMP_SUFFIX);
        try {
            Files.write(tmp, bytes);
            move(tmp, dst);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    static void copy(Path src, Path dst) throws IOException {
        Files.createDirectories(dst.getParent());
        Path tmp = Files.createTempFile(dst.getParent(), TMP_PREFIX, TMP_SUFFIX);
        try {
            try (InputStream in = Files.newInputStream(src)) {
                Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
            }
            move(tmp, dst);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    static boolean isTemp(Path p) {
        String name = p.getFileName().toString();
        return name.startsWith(TMP_PREFIX) && name.endsWith(TMP_SUFFIX);
    }

    private static void move(Path tmp, Path dst) throws IOException {
        try {
            Files.move(tmp, dst, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, dst, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
