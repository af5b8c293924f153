package com.phillippitts.alarmblock.service.settings;

import com.phillippitts.alarmblock.config.properties.SettingsProperties;
import com.phillippitts.alarmblock.domain.GlobalMode;
import com.phillippitts.alarmblock.exception.PersistenceException;
import com.phillippitts.alarmblock.exception.ValidationException;
import com.phillippitts.alarmblock.service.metrics.AlarmMetrics;
import com.phillippitts.alarmblock.service.notification.NotificationSink;
import com.phillippitts.alarmblock.service.validation.VolumeValidator;
import com.phillippitts.alarmblock.util.AtomicFileWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * File-backed {@link SettingsProvider}.
 *
 * <p>File format: {@code {"schedule": "a", "volume": 25, "alarm_volume": 75}}. A missing file,
 * unreadable file or invalid value falls back to the configured defaults field by field.
 * Every change is written with {@link AtomicFileWriter}; a failed write is logged and the
 * in-memory value stays current.
 */
@Component
public class JsonSettingsStore implements SettingsProvider {

    private static final Logger LOG = LogManager.getLogger(JsonSettingsStore.class);

    static final String KEY_SCHEDULE = "schedule";
    static final String KEY_VOLUME = "volume";
    static final String KEY_ALARM_VOLUME = "alarm_volume";

    private final Path path;
    private final NotificationSink notifications;
    private final AlarmMetrics metrics;

    private final Lock lock = new ReentrantLock();
    // Serializes file writes so the last committed value is the one on disk
    private final Lock writeLock = new ReentrantLock();

    private GlobalMode schedule;
    private int volume;
    private int alarmVolume;

    public JsonSettingsStore(SettingsProperties props, NotificationSink notifications, AlarmMetrics metrics) {
        Objects.requireNonNull(props, "props must not be null");
        this.path = props.getPath();
        this.notifications = Objects.requireNonNull(notifications, "notifications must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.schedule = GlobalMode.fromValue(props.getDefaultSchedule()).orElse(GlobalMode.A);
        this.volume = props.getDefaultVolume();
        this.alarmVolume = props.getDefaultAlarmVolume();
        load();
    }

    private void load() {
        if (!Files.exists(path)) {
            LOG.info("No settings file at {}, using defaults (schedule={}, volume={}, alarmVolume={})",
                    path, schedule, volume, alarmVolume);
            return;
        }
        try {
            JSONObject json = new JSONObject(Files.readString(path, StandardCharsets.UTF_8));
            GlobalMode.fromValue(json.optString(KEY_SCHEDULE, null)).ifPresent(m -> schedule = m);
            volume = readVolume(json, KEY_VOLUME, volume);
            alarmVolume = readVolume(json, KEY_ALARM_VOLUME, alarmVolume);
            LOG.info("Settings loaded from {} (schedule={}, volume={}, alarmVolume={})",
                    path, schedule, volume, alarmVolume);
        } catch (IOException | JSONException e) {
            metrics.recordPersistenceFailure("settings");
            LOG.error("Error loading settings from {}, using defaults: {}", path, e.toString());
        }
    }

    private static int readVolume(JSONObject json, String key, int fallback) {
        int value = json.optInt(key, fallback);
        if (value < VolumeValidator.MIN_VOLUME || value > VolumeValidator.MAX_VOLUME) {
            LOG.warn("Ignoring out-of-range {}={} in settings file", key, value);
            return fallback;
        }
        return value;
    }

    @Override
    public GlobalMode getGlobalSchedule() {
        lock.lock();
        try {
            return schedule;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setGlobalSchedule(GlobalMode mode) {
        if (mode == null) {
            throw new ValidationException(KEY_SCHEDULE, null, "must be one of a, b, off");
        }
        lock.lock();
        try {
            schedule = mode;
        } finally {
            lock.unlock();
        }
        save();
        LOG.info("Schedule set to: {}", mode);
        notifications.notifyScheduleChanged(mode);
    }

    @Override
    public int getVolume() {
        lock.lock();
        try {
            return volume;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setVolume(int volume) {
        VolumeValidator.requireInRange(KEY_VOLUME, volume);
        lock.lock();
        try {
            this.volume = volume;
        } finally {
            lock.unlock();
        }
        save();
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
    public void setAlarmVolume(int volume) {
        VolumeValidator.requireInRange(KEY_ALARM_VOLUME, volume);
        lock.lock();
        try {
            this.alarmVolume = volume;
        } finally {
            lock.unlock();
        }
        save();
    }

    /**
     * Writes the current values. Failures are logged; callers are never interrupted by I/O errors.
     *
     * @return {@code true} if the file was written
     */
    boolean save() {
        writeLock.lock();
        try {
            JSONObject json = snapshot();
            AtomicFileWriter.write(path, json.toString(2));
            LOG.debug("Settings saved to {}", path);
            return true;
        } catch (IOException e) {
            metrics.recordPersistenceFailure("settings");
            PersistenceException failure = new PersistenceException(path, "Failed to save settings", e);
            LOG.error(failure.getMessage(), failure);
            return false;
        } finally {
            writeLock.unlock();
        }
    }

    private JSONObject snapshot() {
        lock.lock();
        try {
            JSONObject json = new JSONObject();
            json.put(KEY_SCHEDULE, schedule.value());
            json.put(KEY_VOLUME, volume);
            json.put(KEY_ALARM_VOLUME, alarmVolume);
            return json;
        } finally {
            lock.unlock();
        }
    }
}
