package com.phillippitts.alarmblock.service.audio;

/**
 * Owns the two logical audio channels, alarm and ambient, and the rule that the alarm always wins.
 *
 * <p><b>Channel States:</b>
 * <pre>
 * IDLE → PLAYING (via playAlarm / playAmbient, when a channel could be acquired)
 * PLAYING → PLAYING (playAlarm restarts with a newly selected sound)
 * PLAYING → IDLE (via stopAlarm / stopAmbient)
 * </pre>
 *
 * <p>While the alarm plays, ambient keeps running but is attenuated to the ducking ceiling. When
 * the alarm stops, ambient returns to exactly the volume it had before.
 *
 * <p><b>Idempotence:</b> starting a playing ambient channel or stopping an idle channel does
 * nothing and sends no notification. Subscribers are notified once per state edge.
 *
 * <p><b>Thread Safety:</b> implementations must be thread-safe. Status queries never wait on I/O.
 *
 * @since 1.0
 */
public interface AudioCoordinator {

    /**
     * Starts (or restarts) the alarm sound with a randomly selected alarm track, ducking ambient.
     *
     * @return {@code false} if no channel was free or no alarm sound could be started
     */
    boolean playAlarm();

    /**
     * Stops the alarm sound and restores ambient volume. No-op when the alarm is not playing.
     */
    void stopAlarm();

    /**
     * Starts the ambient track. No-op returning {@code true} when it is already playing.
     *
     * @return {@code false} if no channel was free or the ambient track is unavailable
     */
    boolean playAmbient();

    /**
     * Stops the ambient track. No-op when it is not playing.
     */
    void stopAmbient();

    /**
     * Flips the ambient channel.
     *
     * @return whether ambient is playing afterwards
     */
    boolean toggleAmbient();

    /**
     * Sets, applies and persists the ambient volume.
     *
     * @throws com.phillippitts.alarmblock.exception.ValidationException if outside 0-100
     */
    void setAmbientVolume(int volume);

    /**
     * Sets, applies and persists the alarm volume.
     *
     * @throws com.phillippitts.alarmblock.exception.ValidationException if outside 0-100
     */
    void setAlarmVolume(int volume);

    boolean isAlarmPlaying();

    boolean isAmbientPlaying();

    int getAmbientVolume();

    int getAlarmVolume();

    /**
     * @return all channel state read under one lock acquisition
     */
    AudioStatus getStatus();
}
