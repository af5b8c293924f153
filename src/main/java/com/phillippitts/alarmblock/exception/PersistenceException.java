package com.phillippitts.alarmblock.exception;

import java.nio.file.Path;

/**
 * Thrown when a snapshot (alarms or settings) cannot be read or written.
 */
public class PersistenceException extends AlarmBlockException {

    private final Path path;

    public PersistenceException(Path path, String message, Throwable cause) {
        super(message + " (" + path + ")", cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
