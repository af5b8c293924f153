package com.phillippitts.alarmblock.service.notification.event;

import java.time.Instant;

/**
 * Published when the ambient channel flips between playing and idle.
 */
public record AmbientStatusChangedEvent(boolean playing, Instant at) { }
