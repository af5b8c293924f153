package com.phillippitts.alarmblock.service.audio;

/**
 * Consistent snapshot of both logical channels.
 *
 * @param alarmPlaying   alarm channel is playing
 * @param ambientPlaying ambient channel is playing
 * @param volume         ambient volume as set by the user (not the ducked level)
 * @param alarmVolume    alarm volume
 * @param ambientDucked  ambient is currently attenuated because the alarm is playing
 */
public record AudioStatus(
        boolean alarmPlaying,
        boolean ambientPlaying,
        int volume,
        int alarmVolume,
        boolean ambientDucked
) {
}
