package com.phillippitts.alarmblock.service.validation;

import com.phillippitts.alarmblock.domain.Alarm;
import com.phillippitts.alarmblock.exception.ValidationException;
import org.springframework.stereotype.Component;

/**
 * Enforces the alarm invariants before an alarm reaches the store or the scheduler.
 *
 * <p>Checks run in field order (id, hour, minute, days, schedule) and the first violation wins, so
 * the thrown {@link ValidationException} always names a single offending field.
 */
@Component
public class AlarmValidator {

    public static final int MIN_HOUR = 0;
    public static final int MAX_HOUR = 23;
    public static final int MIN_MINUTE = 0;
    public static final int MAX_MINUTE = 59;
    public static final int MONDAY = 0;
    public static final int SUNDAY = 6;

    /**
     * Validate a complete alarm.
     *
     * @param alarm alarm to check; its id must already be assigned
     * @throws ValidationException when any field violates its range
     */
    public void validate(Alarm alarm) {
        if (alarm == null) {
            throw new ValidationException("alarm", null, "must not be null");
        }
        if (!alarm.hasId()) {
            throw new ValidationException("id", alarm.id(), "must not be blank");
        }
        if (alarm.hour() < MIN_HOUR || alarm.hour() > MAX_HOUR) {
            throw new ValidationException("hour", alarm.hour(),
                    "must be between " + MIN_HOUR + " and " + MAX_HOUR);
        }
        if (alarm.minute() < MIN_MINUTE || alarm.minute() > MAX_MINUTE) {
            throw new ValidationException("minute", alarm.minute(),
                    "must be between " + MIN_MINUTE + " and " + MAX_MINUTE);
        }
        if (alarm.days().isEmpty()) {
            throw new ValidationException("days", alarm.days(), "at least one day must be selected");
        }
        for (Integer day : alarm.days()) {
            if (day < MONDAY || day > SUNDAY) {
                throw new ValidationException("days", alarm.days(),
                        "day " + day + " is out of range (" + MONDAY + "-" + SUNDAY + ")");
            }
        }
        if (alarm.scheduleTag() == null) {
            throw new ValidationException("schedule_tag", null, "must be one of a, b");
        }
    }
}
