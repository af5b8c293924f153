package com.phillippitts.alarmblock.exception;

/**
 * Thrown when the timer mechanism rejects a job (malformed cron expression, executor shut down).
 * The affected alarm stays unscheduled; other alarms are unaffected.
 */
public class SchedulingException extends AlarmBlockException {

    private final String alarmId;

    public SchedulingException(String alarmId, String message, Throwable cause) {
        super("Failed to schedule alarm " + alarmId + ": " + message, cause);
        this.alarmId = alarmId;
    }

    public String getAlarmId() {
        return alarmId;
    }
}
