package com.phillippitts.alarmblock.presentation.controller;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.alarmblock.domain.Alarm;
import com.phillippitts.alarmblock.domain.ScheduleTag;
import com.phillippitts.alarmblock.exception.ValidationException;

import java.util.List;

/**
 * JSON shape of an alarm on the wire. Request fields are boxed so a missing field can be told
 * apart from zero; the legacy {@code schedule} key is accepted for {@code schedule_tag}.
 */
record AlarmPayload(
        String id,
        Integer hour,
        Integer minute,
        List<Integer> days,
        @JsonProperty("schedule_tag") @JsonAlias("schedule") String scheduleTag,
        Boolean active
) {

    static AlarmPayload from(Alarm alarm) {
        return new AlarmPayload(alarm.id(), alarm.hour(), alarm.minute(), List.copyOf(alarm.days()),
                alarm.scheduleTag().value(), alarm.active());
    }

    /**
     * Converts to the domain type. Range checks are left to the coordinator.
     *
     * @throws ValidationException if a required field is missing or the tag is unknown
     */
    Alarm toAlarm() {
        if (hour == null) {
            throw new ValidationException("hour", null, "is required");
        }
        if (minute == null) {
            throw new ValidationException("minute", null, "is required");
        }
        if (days != null && days.contains(null)) {
            throw new ValidationException("days", days, "must not contain null");
        }
        ScheduleTag tag = scheduleTag == null
                ? ScheduleTag.A
                : ScheduleTag.fromValue(scheduleTag).orElseThrow(
                        () -> new ValidationException("schedule_tag", scheduleTag, "must be a or b"));
        return Alarm.of(id, hour, minute, days, tag, active == null || active);
    }
}
