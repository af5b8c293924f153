package com.phillippitts.alarmblock.service.audio;

import java.util.List;
import java.util.Optional;

/**
 * Capability interface over the audio output: a pool of loaded sounds plus a fixed number of
 * playback channels.
 *
 * <p>Two implementations exist, a real one backed by {@code javax.sound.sampled} and a simulated
 * one for headless hosts and tests. Exactly one is selected at startup by {@code audio.mode}.
 *
 * <p><b>Thread Safety:</b> implementations must be thread-safe; channel acquisition never blocks.
 */
public interface SoundSource extends AutoCloseable {

    /**
     * @return keys of every loaded alarm sound, in a stable order; empty when none loaded
     */
    List<String> alarmSoundKeys();

    /**
     * @return key of the ambient track, or empty when it could not be loaded
     */
    Optional<String> ambientSoundKey();

    /**
     * Reserves a free channel. The channel stays reserved until {@link PlaybackChannel#stop()}.
     *
     * @return a reserved channel, or empty immediately if all channels are busy
     */
    Optional<PlaybackChannel> acquireChannel();

    /**
     * @return total number of channels in the pool
     */
    int channelCount();

    /**
     * @return short name of the output backend, e.g. {@code javasound} or {@code simulated}
     */
    String mode();

    /**
     * Stops every channel and releases loaded sounds. Does not throw.
     */
    @Override
    void close();
}
