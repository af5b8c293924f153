package com.phillippitts.alarmblock.exception;

/**
 * Thrown when caller input violates a domain invariant (alarm fields, volume range, schedule value).
 *
 * <p>Raised before any state mutation, so the caller may correct the input and retry.
 */
public class ValidationException extends AlarmBlockException {

    private final String field;
    private final transient Object rejectedValue;

    public ValidationException(String field, Object rejectedValue, String reason) {
        super("Invalid " + field + " (" + rejectedValue + "): " + reason);
        this.field = field;
        this.rejectedValue = rejectedValue;
    }

    public String getField() {
        return field;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }
}
