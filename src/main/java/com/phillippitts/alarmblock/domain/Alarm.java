package com.phillippitts.alarmblock.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Immutable recurring trigger definition.
 *
 * <p>The record only normalizes its input: {@code days} is copied into an unmodifiable sorted set
 * (duplicates collapse, null becomes empty). Range checks live in
 * {@link com.phillippitts.alarmblock.service.validation.AlarmValidator} so that a rejected field
 * can be reported by name.
 *
 * @param id          opaque unique identifier
 * @param hour        local hour, 0-23
 * @param minute      local minute, 0-59
 * @param days        weekdays, 0=Monday .. 6=Sunday
 * @param scheduleTag schedule this alarm belongs to
 * @param active      inactive alarms stay scheduled but never sound
 */
public record Alarm(
        String id,
        int hour,
        int minute,
        SortedSet<Integer> days,
        ScheduleTag scheduleTag,
        boolean active
) {

    private static final String[] DAY_ABBREVIATIONS = {"Mon", "Tue", "Wed", "Thu", "Fri", "Sat", "Sun"};

    public Alarm {
        days = days == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(days));
    }

    /**
     * Creates an alarm from any collection of weekdays.
     */
    public static Alarm of(String id, int hour, int minute, Collection<Integer> days,
                           ScheduleTag scheduleTag, boolean active) {
        return new Alarm(id, hour, minute, days == null ? null : new TreeSet<>(days), scheduleTag, active);
    }

    /**
     * Returns a copy carrying a freshly generated id.
     */
    public Alarm withGeneratedId() {
        return new Alarm(UUID.randomUUID().toString(), hour, minute, days, scheduleTag, active);
    }

    /**
     * Whether the id is missing and must be generated before the alarm is stored.
     */
    public boolean hasId() {
        return id != null && !id.isBlank();
    }

    /**
     * Human-readable form for logs, e.g. {@code 07:30 on Mon, Tue (schedule: a, active)}.
     */
    public String describe() {
        String dayNames = days.stream()
                .map(d -> d >= 0 && d < DAY_ABBREVIATIONS.length ? DAY_ABBREVIATIONS[d] : String.valueOf(d))
                .collect(Collectors.joining(", "));
        return String.format("%02d:%02d on %s (schedule: %s, %s)",
                hour, minute, dayNames, scheduleTag, active ? "active" : "inactive");
    }
}
