package com.phillippitts.alarmblock.service.notification.event;

import com.phillippitts.alarmblock.domain.Alarm;

import java.time.Instant;
import java.util.List;

/**
 * Published after alarms were added, replaced or removed. Carries the complete list.
 */
public record AlarmListChangedEvent(List<Alarm> alarms, Instant at) {
    public AlarmListChangedEvent {
        alarms = alarms == null ? List.of() : List.copyOf(alarms);
    }
}
