package com.phillippitts.alarmblock.service.alarm;

/**
 * Outcome of gating one fired trigger. Only {@link #PLAY} produces sound; every other value is a
 * normal, logged non-event.
 */
public enum GateDecision {
    PLAY,
    /** The alarm was deleted after its job fired. */
    BLOCKED_MISSING,
    /** The global schedule is {@code off}. */
    BLOCKED_OFF,
    /** The alarm belongs to the schedule that is not selected. */
    BLOCKED_SCHEDULE_MISMATCH,
    BLOCKED_INACTIVE;

    public boolean plays() {
        return this == PLAY;
    }
}
