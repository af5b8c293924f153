package com.phillippitts.alarmblock.service.alarm;

import com.phillippitts.alarmblock.domain.Alarm;

import java.util.List;

/**
 * Alarm bookkeeping: keeps the store, the scheduler and the snapshot file in step, and gates fired
 * triggers before they reach the audio coordinator.
 *
 * <p><b>Thread Safety:</b> implementations must be thread-safe. Trigger callbacks arrive on
 * scheduler threads while edits arrive on request threads.
 */
public interface AlarmCoordinator extends TriggerHandler {

    /**
     * Validates, stores, schedules and persists an alarm, replacing any alarm with the same id.
     * A missing id is generated.
     *
     * @return the alarm as stored (with its id)
     * @throws com.phillippitts.alarmblock.exception.ValidationException if a field is invalid;
     *         nothing is stored or scheduled in that case
     */
    Alarm setAlarm(Alarm alarm);

    /**
     * Removes every listed alarm that exists. Missing ids are skipped.
     *
     * @return {@code true} only if every id was found and removed
     */
    boolean removeAlarms(List<String> alarmIds);

    /**
     * @return snapshot of all alarms in creation order
     */
    List<Alarm> getAlarms();
}
