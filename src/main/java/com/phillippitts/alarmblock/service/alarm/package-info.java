/**
 * Alarm bookkeeping and trigger handling.
 *
 * <p>Components:
 * <ul>
 *   <li>{@link com.phillippitts.alarmblock.service.alarm.AlarmStore} - in-memory registry with a
 *       JSON snapshot file</li>
 *   <li>{@link com.phillippitts.alarmblock.service.alarm.TriggerScheduler} - one recurring timer
 *       per alarm</li>
 *   <li>{@link com.phillippitts.alarmblock.service.alarm.TriggerGate} - decides whether a fired
 *       alarm sounds</li>
 *   <li>{@link com.phillippitts.alarmblock.service.alarm.AlarmCoordinator} - keeps the three in
 *       step and hands passing triggers to the audio coordinator</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.alarmblock.service.alarm;
