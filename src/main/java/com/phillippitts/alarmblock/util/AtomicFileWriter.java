package com.phillippitts.alarmblock.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes a file by writing a temporary sibling and renaming it over the target.
 *
 * <p>Readers see either the previous content or the new content, never a truncated file.
 * The temporary file lives in the target's directory so the rename stays on one file system.
 *
 * @since 1.0
 */
public final class AtomicFileWriter {

    private AtomicFileWriter() {
        // Utility class - prevent instantiation
    }

    /**
     * Atomically replaces {@code target} with {@code content} (UTF-8).
     *
     * @param target file to write; parent directories are created when missing
     * @param content full new content
     * @throws IOException when the temporary file cannot be written or moved; the target is untouched
     */
    public static void write(Path target, String content) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path dir = absolute.getParent();
        Files.createDirectories(dir);
        Path temp = Files.createTempFile(dir, absolute.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
