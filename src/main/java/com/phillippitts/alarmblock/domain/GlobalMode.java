package com.phillippitts.alarmblock.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Global schedule selector. {@link #OFF} suppresses every trigger.
 */
public enum GlobalMode {
    A("a"),
    B("b"),
    OFF("off");

    private final String value;

    GlobalMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Whether alarms tagged with {@code tag} may sound in this mode.
     */
    public boolean selects(ScheduleTag tag) {
        return tag != null && this != OFF && value.equals(tag.value());
    }

    public static Optional<GlobalMode> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (GlobalMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return value;
    }
}
