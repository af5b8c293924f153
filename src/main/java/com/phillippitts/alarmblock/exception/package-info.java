/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.alarmblock.exception.AlarmBlockException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.alarmblock.exception.ValidationException} - Malformed alarm
 *       fields, out-of-range volume or unknown schedule; the only failure callers see from
 *       mutating operations</li>
 *   <li>{@link com.phillippitts.alarmblock.exception.SchedulingException} - The timer rejected
 *       a job; logged and absorbed by the coordinator</li>
 *   <li>{@link com.phillippitts.alarmblock.exception.PersistenceException} - Snapshot read or
 *       write failed; logged, in-memory state stays authoritative</li>
 * </ul>
 *
 * <p>Running out of playback channels is not an exception: {@code play*} methods return
 * {@code false}.
 *
 * @see com.phillippitts.alarmblock.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.alarmblock.exception;
