package com.phillippitts.alarmblock.service.audio;

import com.phillippitts.alarmblock.exception.AudioPlaybackException;
import com.phillippitts.alarmblock.service.metrics.AlarmMetrics;
import com.phillippitts.alarmblock.service.notification.NotificationSink;
import com.phillippitts.alarmblock.service.settings.SettingsProvider;
import com.phillippitts.alarmblock.service.validation.VolumeValidator;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.IntConsumer;
import java.util.function.IntSupplier;

/**
 * Default {@link AudioCoordinator} over a {@link SoundSource}.
 *
 * <p>Channel handles are published to state only after {@code play} returned, under the lock, so
 * a concurrent {@link #stopAlarm()} always stops the channel that is actually sounding.
 *
 * <p>Volume changes are applied under the lock and persisted through the {@link SettingsProvider}
 * after it is released, under a separate persist lock that writes the then-current value. A failed
 * persist is logged; the live value stays in effect.
 *
 * <p><b>Thread Safety:</b> every method takes one {@link ReentrantLock}. The lock is distinct from
 * the alarm coordinator's lock; this class never calls back into alarm bookkeeping.
 *
 * @since 1.0
 */
public class DefaultAudioCoordinator implements AudioCoordinator {

    private static final Logger LOG = LogManager.getLogger(DefaultAudioCoordinator.class);

    static final String CHANNEL_ALARM = "alarm";
    static final String CHANNEL_AMBIENT = "ambient";

    private final SoundSource soundSource;
    private final SettingsProvider settings;
    private final NotificationSink notifications;
    private final AlarmMetrics metrics;
    private final int duckingCeiling;
    private final Random random;

    private final Lock lock = new ReentrantLock();
    // Serializes settings writes; taken before, never while holding, the state lock
    private final Lock persistLock = new ReentrantLock();

    private PlaybackChannel alarmChannel;
    private PlaybackChannel ambientChannel;
    private String alarmSoundKey;
    private int ambientVolume;
    private int alarmVolume;
    // Ambient volume captured when the alarm ducked it; null while not ducked
    private Integer duckedFromVolume;

    public DefaultAudioCoordinator(SoundSource soundSource,
                                   SettingsProvider settings,
                                   NotificationSink notifications,
                                   AlarmMetrics metrics,
                                   int duckingCeiling) {
        this(soundSource, settings, notifications, metrics, duckingCeiling, new Random());
    }

    /**
     * @param random source for alarm sound selection; tests pass a seeded instance
     */
    public DefaultAudioCoordinator(SoundSource soundSource,
                                   SettingsProvider settings,
                                   NotificationSink notifications,
                                   AlarmMetrics metrics,
                                   int duckingCeiling,
                                   Random random) {
        this.soundSource = Objects.requireNonNull(soundSource, "soundSource must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.notifications = Objects.requireNonNull(notifications, "notifications must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.duckingCeiling = VolumeValidator.requireInRange("ducking_ceiling", duckingCeiling);
        this.random = Objects.requireNonNull(random, "random must not be null");
        this.ambientVolume = settings.getVolume();
        this.alarmVolume = settings.getAlarmVolume();
        LOG.info("Audio coordinator ready (mode={}, channels={}, alarmSounds={}, volume={}, alarmVolume={})",
                soundSource.mode(), soundSource.channelCount(), soundSource.alarmSoundKeys().size(),
                ambientVolume, alarmVolume);
    }

    @Override
    public boolean playAlarm() {
        lock.lock();
        try {
            boolean restarting = alarmChannel != null;
            if (restarting) {
                LOG.info("Alarm already playing; restarting with a new sound");
                alarmChannel.stop();
                alarmChannel = null;
                alarmSoundKey = null;
            }

            List<String> keys = soundSource.alarmSoundKeys();
            if (keys.isEmpty()) {
                metrics.recordPlaybackFailure(CHANNEL_ALARM, "no_sound");
                LOG.warn("No alarm sounds available");
                abandonAlarmStart(restarting);
                return false;
            }
            String key = keys.get(random.nextInt(keys.size()));

            duckAmbient();

            Optional<PlaybackChannel> acquired = soundSource.acquireChannel();
            if (acquired.isEmpty()) {
                metrics.recordPlaybackFailure(CHANNEL_ALARM, "no_channel");
                LOG.warn("Failed to get channel for alarm: all {} channels busy", soundSource.channelCount());
                abandonAlarmStart(restarting);
                return false;
            }

            PlaybackChannel channel = acquired.get();
            try {
                channel.setVolume(alarmVolume);
                channel.play(key, true);
            } catch (AudioPlaybackException e) {
                channel.stop();
                metrics.recordPlaybackFailure(CHANNEL_ALARM, "playback_error");
                LOG.error("Failed to start alarm sound {}", key, e);
                abandonAlarmStart(restarting);
                return false;
            }

            alarmChannel = channel;
            alarmSoundKey = key;
            LOG.info("Playing alarm sound {} on channel {} at volume {}", key, channel.id(), alarmVolume);
            if (!restarting) {
                notifications.notifyAlarmStatus(true);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Undoes a partial alarm start. When the start was a restart the alarm has gone from playing
     * to idle, which is an edge subscribers must see.
     */
    private void abandonAlarmStart(boolean wasPlaying) {
        restoreAmbient();
        if (wasPlaying) {
            notifications.notifyAlarmStatus(false);
        }
    }

    @Override
    public void stopAlarm() {
        lock.lock();
        try {
            if (alarmChannel == null) {
                LOG.debug("Alarm not playing; nothing to stop");
                return;
            }
            alarmChannel.stop();
            LOG.info("Stopped alarm sound {} on channel {}", alarmSoundKey, alarmChannel.id());
            alarmChannel = null;
            alarmSoundKey = null;
            restoreAmbient();
            notifications.notifyAlarmStatus(false);
        } finally {
            lock.unlock();
        }
    }

    private void duckAmbient() {
        if (ambientChannel == null) {
            return;
        }
        if (duckedFromVolume == null) {
            duckedFromVolume = ambientVolume;
        }
        int ducked = Math.min(ambientVolume, duckingCeiling);
        ambientChannel.setVolume(ducked);
        LOG.debug("Ducked ambient from {} to {}", duckedFromVolume, ducked);
    }

    private void restoreAmbient() {
        if (ambientChannel != null && duckedFromVolume != null) {
            ambientChannel.setVolume(duckedFromVolume);
            LOG.debug("Restored ambient volume to {}", duckedFromVolume);
        }
        duckedFromVolume = null;
    }

    @Override
    public boolean playAmbient() {
        lock.lock();
        try {
            if (ambientChannel != null) {
                return true;
            }
            Optional<String> key = soundSource.ambientSoundKey();
            if (key.isEmpty()) {
                metrics.recordPlaybackFailure(CHANNEL_AMBIENT, "no_sound");
                LOG.warn("Ambient sound not available");
                return false;
            }
            Optional<PlaybackChannel> acquired = soundSource.acquireChannel();
            if (acquired.isEmpty()) {
                metrics.recordPlaybackFailure(CHANNEL_AMBIENT, "no_channel");
                LOG.warn("Failed to get channel for ambient: all {} channels busy", soundSource.channelCount());
                return false;
            }

            PlaybackChannel channel = acquired.get();
            boolean ducked = alarmChannel != null;
            int startVolume = ducked ? Math.min(ambientVolume, duckingCeiling) : ambientVolume;
            try {
                channel.setVolume(startVolume);
                channel.play(key.get(), true);
            } catch (AudioPlaybackException e) {
                channel.stop();
                metrics.recordPlaybackFailure(CHANNEL_AMBIENT, "playback_error");
                LOG.error("Failed to start ambient sound {}", key.get(), e);
                return false;
            }

            ambientChannel = channel;
            if (ducked) {
                duckedFromVolume = ambientVolume;
            }
            LOG.info("Playing ambient sound {} on channel {} at volume {}", key.get(), channel.id(), startVolume);
            notifications.notifyAmbientStatus(true);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void stopAmbient() {
        lock.lock();
        try {
            if (ambientChannel == null) {
                LOG.debug("Ambient not playing; nothing to stop");
                return;
            }
            ambientChannel.stop();
            LOG.info("Stopped ambient sound on channel {}", ambientChannel.id());
            ambientChannel = null;
            duckedFromVolume = null;
            notifications.notifyAmbientStatus(false);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean toggleAmbient() {
        lock.lock();
        try {
            if (ambientChannel != null) {
                stopAmbient();
                return false;
            }
            return playAmbient();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setAmbientVolume(int volume) {
        VolumeValidator.requireInRange("volume", volume);
        lock.lock();
        try {
            ambientVolume = volume;
            if (duckedFromVolume != null) {
                duckedFromVolume = volume;
            }
            if (ambientChannel != null) {
                ambientChannel.setVolume(alarmChannel != null ? Math.min(volume, duckingCeiling) : volume);
            }
            notifications.notifyVolume(volume);
        } finally {
            lock.unlock();
        }
        LOG.info("Volume set to: {}", volume);
        persist("volume", this::getAmbientVolume, settings::setVolume);
    }

    @Override
    public void setAlarmVolume(int volume) {
        VolumeValidator.requireInRange("alarm_volume", volume);
        lock.lock();
        try {
            alarmVolume = volume;
            if (alarmChannel != null) {
                alarmChannel.setVolume(volume);
            }
            notifications.notifyAlarmVolume(volume);
        } finally {
            lock.unlock();
        }
        LOG.info("Alarm volume set to: {}", volume);
        persist("alarm_volume", this::getAlarmVolume, settings::setAlarmVolume);
    }

    /**
     * Writes the value in effect at the time of the write, not the caller's argument. Concurrent
     * setters leave the last applied value on disk.
     */
    private void persist(String setting, IntSupplier current, IntConsumer write) {
        persistLock.lock();
        try {
            write.accept(current.getAsInt());
        } catch (RuntimeException e) {
            LOG.error("Failed to persist {}; live value kept", setting, e);
        } finally {
            persistLock.unlock();
        }
    }

    @Override
    public boolean isAlarmPlaying() {
        lock.lock();
        try {
            return alarmChannel != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isAmbientPlaying() {
        lock.lock();
        try {
            return ambientChannel != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getAmbientVolume() {
        lock.lock();
        try {
            return ambientVolume;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getAlarmVolume() {
        lock.lock();
        try {
            return alarmVolume;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public AudioStatus getStatus() {
        lock.lock();
        try {
            return new AudioStatus(alarmChannel != null, ambientChannel != null,
                    ambientVolume, alarmVolume, ambientChannel != null && alarmChannel != null);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Silences both channels and releases the output device. Subscribers are not notified.
     */
    @PreDestroy
    public void shutdown() {
        lock.lock();
        try {
            if (alarmChannel != null) {
                alarmChannel.stop();
                alarmChannel = null;
            }
            if (ambientChannel != null) {
                ambientChannel.stop();
                ambientChannel = null;
            }
            duckedFromVolume = null;
        } finally {
            lock.unlock();
        }
        soundSource.close();
        LOG.info("Audio coordinator shut down");
    }
}
