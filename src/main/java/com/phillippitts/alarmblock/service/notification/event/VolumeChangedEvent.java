package com.phillippitts.alarmblock.service.notification.event;

import java.time.Instant;

/**
 * Published when a volume level changes.
 *
 * @param channel which volume changed
 * @param volume  new level, 0-100
 */
public record VolumeChangedEvent(Channel channel, int volume, Instant at) {

    public enum Channel { AMBIENT, ALARM }
}
