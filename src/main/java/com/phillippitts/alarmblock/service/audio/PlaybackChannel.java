package com.phillippitts.alarmblock.service.audio;

/**
 * One reserved output channel obtained from {@link SoundSource#acquireChannel()}.
 */
public interface PlaybackChannel {

    /**
     * @return index of this channel within its pool
     */
    int id();

    /**
     * Starts playing a loaded sound, replacing anything this channel was playing.
     *
     * @param soundKey key returned by the sound source
     * @param loop     {@code true} to repeat until stopped
     * @throws com.phillippitts.alarmblock.exception.AudioPlaybackException if the sound is unknown
     *         or the device refuses to start it
     */
    void play(String soundKey, boolean loop);

    /**
     * Applies a volume live. Values are clamped to 0-100.
     */
    void setVolume(int percent);

    /**
     * Stops playback and returns the channel to the pool. Calling it again has no effect.
     */
    void stop();

    /**
     * @return {@code true} while reserved
     */
    boolean isBusy();
}
