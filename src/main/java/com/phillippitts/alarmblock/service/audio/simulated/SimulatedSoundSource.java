package com.phillippitts.alarmblock.service.audio.simulated;

import com.phillippitts.alarmblock.exception.AudioPlaybackException;
import com.phillippitts.alarmblock.service.audio.PlaybackChannel;
import com.phillippitts.alarmblock.service.audio.SoundSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link SoundSource} that produces no sound. Channels record what they were asked to do so the
 * rest of the application behaves exactly as with a real device.
 *
 * <p>Used on hosts without an audio mixer and in tests.
 */
public class SimulatedSoundSource implements SoundSource {

    private static final Logger LOG = LogManager.getLogger(SimulatedSoundSource.class);

    public static final String MODE = "simulated";

    private final List<String> alarmSounds;
    private final String ambientSound;
    private final List<SimulatedChannel> channels;

    /**
     * @param alarmSounds  keys reported as loaded alarm sounds
     * @param ambientSound key of the ambient track, or {@code null} for none
     * @param channelCount size of the channel pool
     */
    public SimulatedSoundSource(List<String> alarmSounds, String ambientSound, int channelCount) {
        if (channelCount < 1) {
            throw new IllegalArgumentException("channelCount must be at least 1, got " + channelCount);
        }
        this.alarmSounds = List.copyOf(Objects.requireNonNull(alarmSounds, "alarmSounds must not be null"));
        this.ambientSound = ambientSound == null || ambientSound.isBlank() ? null : ambientSound;
        List<SimulatedChannel> pool = new ArrayList<>(channelCount);
        for (int i = 0; i < channelCount; i++) {
            pool.add(new SimulatedChannel(i));
        }
        this.channels = List.copyOf(pool);
        LOG.info("Simulated audio output: {} alarm sounds, ambient={}, {} channels",
                this.alarmSounds.size(), this.ambientSound, channelCount);
    }

    @Override
    public List<String> alarmSoundKeys() {
        return alarmSounds;
    }

    @Override
    public Optional<String> ambientSoundKey() {
        return Optional.ofNullable(ambientSound);
    }

    @Override
    public Optional<PlaybackChannel> acquireChannel() {
        for (SimulatedChannel channel : channels) {
            if (channel.reserve()) {
                return Optional.of(channel);
            }
        }
        return Optional.empty();
    }

    @Override
    public int channelCount() {
        return channels.size();
    }

    @Override
    public String mode() {
        return MODE;
    }

    /**
     * @return every channel in the pool, busy or not
     */
    public List<SimulatedChannel> channels() {
        return channels;
    }

    @Override
    public void close() {
        channels.forEach(SimulatedChannel::stop);
    }

    private boolean isKnown(String soundKey) {
        return alarmSounds.contains(soundKey) || soundKey.equals(ambientSound);
    }

    /**
     * Channel that only records its state.
     */
    public final class SimulatedChannel implements PlaybackChannel {

        private final int id;
        private final AtomicBoolean busy = new AtomicBoolean(false);
        private volatile String playing;
        private volatile boolean looping;
        private volatile int volume = 100;

        SimulatedChannel(int id) {
            this.id = id;
        }

        boolean reserve() {
            return busy.compareAndSet(false, true);
        }

        @Override
        public int id() {
            return id;
        }

        @Override
        public void play(String soundKey, boolean loop) {
            if (soundKey == null || !isKnown(soundKey)) {
                throw new AudioPlaybackException(String.valueOf(soundKey), "sound not loaded", null);
            }
            playing = soundKey;
            looping = loop;
            LOG.debug("[simulated] channel {} playing {} (loop={}, volume={})", id, soundKey, loop, volume);
        }

        @Override
        public void setVolume(int percent) {
            volume = Math.max(0, Math.min(100, percent));
        }

        @Override
        public void stop() {
            playing = null;
            looping = false;
            busy.set(false);
        }

        @Override
        public boolean isBusy() {
            return busy.get();
        }

        /**
         * @return key currently playing, or {@code null}
         */
        public String playing() {
            return playing;
        }

        public boolean looping() {
            return looping;
        }

        public int volume() {
            return volume;
        }
    }
}
