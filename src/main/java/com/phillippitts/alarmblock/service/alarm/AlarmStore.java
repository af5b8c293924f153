package com.phillippitts.alarmblock.service.alarm;

import com.phillippitts.alarmblock.domain.Alarm;
import com.phillippitts.alarmblock.exception.PersistenceException;
import com.phillippitts.alarmblock.service.metrics.AlarmMetrics;
import com.phillippitts.alarmblock.service.validation.AlarmValidator;
import com.phillippitts.alarmblock.util.AtomicFileWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory registry of alarms keyed by id, backed by a JSON snapshot file.
 *
 * <p>Insertion order is preserved so the snapshot and {@link #getAll()} list alarms in the order
 * they were first created. Every read returns a copy; callers never observe a mutation in progress.
 *
 * <p><b>Failure policy:</b> a missing or unreadable snapshot loads as an empty store, a malformed
 * record is skipped, and a failed write is logged and reported as {@code false}. None of these
 * throw.
 */
public class AlarmStore {

    private static final Logger LOG = LogManager.getLogger(AlarmStore.class);

    private final Path path;
    private final AlarmValidator validator;
    private final AlarmMetrics metrics;

    private final Lock lock = new ReentrantLock();
    private final Map<String, Alarm> alarms = new LinkedHashMap<>();

    public AlarmStore(Path path, AlarmValidator validator, AlarmMetrics metrics) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Replaces the in-memory contents with the snapshot on disk.
     *
     * @return copy of the loaded alarms keyed by id, in file order
     */
    public Map<String, Alarm> load() {
        Map<String, Alarm> loaded = new LinkedHashMap<>();
        if (!Files.exists(path)) {
            LOG.warn("No alarms file found at {}", path);
        } else {
            try {
                AlarmJsonCodec.Decoded decoded = AlarmJsonCodec.decode(
                        Files.readString(path, StandardCharsets.UTF_8), validator);
                for (String reason : decoded.rejected()) {
                    LOG.error("Skipping invalid alarm in {}: {}", path, reason);
                }
                for (Alarm alarm : decoded.alarms()) {
                    loaded.put(alarm.id(), alarm);
                }
            } catch (IOException | JSONException e) {
                metrics.recordPersistenceFailure("alarms");
                LOG.error("Error loading alarms from {}, starting empty: {}", path, e.toString());
                loaded.clear();
            }
        }

        lock.lock();
        try {
            alarms.clear();
            alarms.putAll(loaded);
        } finally {
            lock.unlock();
        }
        LOG.info("Total alarms after load: {}", loaded.size());
        return new LinkedHashMap<>(loaded);
    }

    /**
     * Writes every alarm currently in memory to the snapshot file atomically.
     *
     * @return {@code true} if the snapshot was written, {@code false} if the write failed
     */
    public boolean save() {
        lock.lock();
        try {
            AtomicFileWriter.write(path, AlarmJsonCodec.encode(alarms.values()));
            LOG.info("Saved {} alarms to {}", alarms.size(), path);
            return true;
        } catch (IOException e) {
            metrics.recordPersistenceFailure("alarms");
            PersistenceException failure = new PersistenceException(path, "Failed to save alarms", e);
            LOG.error(failure.getMessage(), failure);
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return snapshot copy of all alarms in insertion order
     */
    public List<Alarm> getAll() {
        lock.lock();
        try {
            return List.copyOf(alarms.values());
        } finally {
            lock.unlock();
        }
    }

    public Optional<Alarm> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.ofNullable(alarms.get(id));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Inserts or fully replaces the alarm with the same id. A replaced alarm keeps its position.
     *
     * @return the previous alarm with this id, if any
     */
    public Optional<Alarm> put(Alarm alarm) {
        Objects.requireNonNull(alarm, "alarm must not be null");
        lock.lock();
        try {
            return Optional.ofNullable(alarms.put(alarm.id(), alarm));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the removed alarm, or empty when no alarm had this id
     */
    public Optional<Alarm> remove(String id) {
        if (id == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.ofNullable(alarms.remove(id));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return alarms.size();
        } finally {
            lock.unlock();
        }
    }
}
