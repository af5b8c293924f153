package com.phillippitts.alarmblock.service.notification.event;

import java.time.Instant;

/**
 * Published when the alarm channel flips between playing and idle.
 */
public record AlarmStatusChangedEvent(boolean playing, Instant at) { }
