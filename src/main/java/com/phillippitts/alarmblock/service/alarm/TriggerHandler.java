package com.phillippitts.alarmblock.service.alarm;

import java.time.Instant;

/**
 * Callback invoked by a {@link TriggerScheduler} on its own thread when an alarm's time comes.
 */
@FunctionalInterface
public interface TriggerHandler {

    /**
     * @param alarmId     id of the alarm whose job fired
     * @param scheduledAt the wall-clock instant the job was due
     */
    void onTrigger(String alarmId, Instant scheduledAt);
}
