package com.sitemonitor.service.store;

import com.sitemonitor.core.util.JsonUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes a JSON document next to its target and moves it into place, so a crash mid-write leaves
 * the previous version intact.
 */
public final class AtomicJsonFiles {
    private AtomicJsonFiles() {
    }

    public static void write(Path file, Object value) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, file.getFileName().toString() + "-", ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(temp)) {
                JsonUtils.prettyWriter().writeValue(out, value);
            }
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
