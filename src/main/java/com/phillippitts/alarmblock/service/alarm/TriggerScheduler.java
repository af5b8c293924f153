package com.phillippitts.alarmblock.service.alarm;

import com.phillippitts.alarmblock.domain.Alarm;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Maintains one recurring timer per alarm, keyed by alarm id.
 *
 * <p>Jobs re-arm after every fire. Fires are delivered to the registered {@link TriggerHandler}
 * on a scheduler-owned thread, never synchronously from {@link #schedule(Alarm)}.
 */
public interface TriggerScheduler {

    /**
     * Registers the callback that receives every fire. Must be called before any job is due.
     */
    void setTriggerHandler(TriggerHandler handler);

    /**
     * Replaces any job for {@code alarm.id()} with a new one for the alarm's hour, minute and days.
     *
     * @throws com.phillippitts.alarmblock.exception.SchedulingException if the job cannot be installed;
     *         the alarm is left unscheduled
     */
    void schedule(Alarm alarm);

    /**
     * Removes the job for {@code alarmId}; does nothing when none exists.
     *
     * @return {@code true} if a job was removed
     */
    boolean unschedule(String alarmId);

    /**
     * Drops every job, then schedules each alarm. A failure for one alarm is logged and the rest
     * are still scheduled.
     *
     * @return number of alarms successfully scheduled
     */
    int rescheduleAll(Collection<Alarm> alarms);

    /**
     * Removes every job.
     */
    void unscheduleAll();

    boolean isScheduled(String alarmId);

    /**
     * @return the next instant the job for {@code alarmId} is due, if it is scheduled
     */
    Optional<Instant> nextFireTime(String alarmId);

    Set<String> scheduledIds();
}
