package com.phillippitts.alarmblock.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Named schedule an alarm belongs to. An alarm only sounds while the global mode selects its tag.
 */
public enum ScheduleTag {
    A("a"),
    B("b");

    private final String value;

    ScheduleTag(String value) {
        this.value = value;
    }

    /** Wire value as stored in snapshots and API payloads. */
    public String value() {
        return value;
    }

    /**
     * Parses a wire value ("a" or "b", case-insensitive).
     *
     * @return the tag, or empty for null/unknown input
     */
    public static Optional<ScheduleTag> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ScheduleTag tag : values()) {
            if (tag.value.equals(normalized)) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return value;
    }
}
