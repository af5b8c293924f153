package com.phillippitts.alarmblock.service.notification.event;

import com.phillippitts.alarmblock.domain.GlobalMode;

import java.time.Instant;

/**
 * Published when the global schedule selector changes.
 */
public record ScheduleChangedEvent(GlobalMode mode, Instant at) { }
