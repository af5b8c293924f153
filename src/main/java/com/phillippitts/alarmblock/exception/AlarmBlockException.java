package com.phillippitts.alarmblock.exception;

/**
 * Base exception for all alarm-block application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class AlarmBlockException extends RuntimeException {

    public AlarmBlockException(String message) {
        super(message);
    }

    public AlarmBlockException(String message, Throwable cause) {
        super(message, cause);
    }
}
