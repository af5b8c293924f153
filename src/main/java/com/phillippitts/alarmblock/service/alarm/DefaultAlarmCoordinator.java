package com.phillippitts.alarmblock.service.alarm;

import com.phillippitts.alarmblock.domain.Alarm;
import com.phillippitts.alarmblock.domain.GlobalMode;
import com.phillippitts.alarmblock.exception.SchedulingException;
import com.phillippitts.alarmblock.exception.ValidationException;
import com.phillippitts.alarmblock.service.audio.AudioCoordinator;
import com.phillippitts.alarmblock.service.metrics.AlarmMetrics;
import com.phillippitts.alarmblock.service.notification.NotificationSink;
import com.phillippitts.alarmblock.service.settings.SettingsProvider;
import com.phillippitts.alarmblock.service.validation.AlarmValidator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.SmartLifecycle;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default {@link AlarmCoordinator}.
 *
 * <p><b>Edits:</b> store update, job installation, snapshot write and list notification all happen
 * while holding one lock, so no reader sees an alarm that is scheduled but not saved, and edits
 * to the same id apply in call order.
 *
 * <p><b>Triggers:</b> the alarm is looked up under the lock, the lock is released, and only then
 * is the gate evaluated and the {@link AudioCoordinator} called. This coordinator never holds its
 * lock while waiting on the audio lock.
 *
 * <p><b>Lifecycle:</b> on start the snapshot is loaded and every alarm scheduled; on stop every
 * job is cancelled. A scheduling failure for one alarm leaves the others unaffected.
 *
 * @since 1.0
 */
public class DefaultAlarmCoordinator implements AlarmCoordinator, SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(DefaultAlarmCoordinator.class);

    static final String MDC_ALARM_ID = "alarmId";

    private final AlarmStore store;
    private final TriggerScheduler scheduler;
    private final SettingsProvider settings;
    private final AudioCoordinator audio;
    private final NotificationSink notifications;
    private final AlarmValidator validator;
    private final AlarmMetrics metrics;
    private final TriggerGate gate;

    private final Lock lock = new ReentrantLock();
    private volatile boolean running;

    public DefaultAlarmCoordinator(AlarmStore store,
                                   TriggerScheduler scheduler,
                                   SettingsProvider settings,
                                   AudioCoordinator audio,
                                   NotificationSink notifications,
                                   AlarmValidator validator,
                                   AlarmMetrics metrics,
                                   TriggerGate gate) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.audio = Objects.requireNonNull(audio, "audio must not be null");
        this.notifications = Objects.requireNonNull(notifications, "notifications must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        scheduler.setTriggerHandler(this);
    }

    @Override
    public Alarm setAlarm(Alarm alarm) {
        if (alarm == null) {
            throw new ValidationException("alarm", null, "must not be null");
        }
        Alarm candidate = alarm.hasId() ? alarm : alarm.withGeneratedId();
        validator.validate(candidate);

        lock.lock();
        try {
            Optional<Alarm> previous = store.put(candidate);
            try {
                scheduler.schedule(candidate);
            } catch (SchedulingException e) {
                LOG.error("Alarm {} saved but not scheduled: {}", candidate.id(), e.getMessage(), e);
            }
            store.save();
            notifications.notifyAlarmList(store.getAll());
            LOG.info("{} alarm {}: {}", previous.isPresent() ? "Updated" : "Added",
                    candidate.id(), candidate.describe());
            return candidate;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean removeAlarms(List<String> alarmIds) {
        if (alarmIds == null) {
            throw new ValidationException("alarm_ids", null, "must not be null");
        }
        lock.lock();
        try {
            boolean allRemoved = true;
            int removed = 0;
            for (String alarmId : alarmIds) {
                scheduler.unschedule(alarmId);
                if (store.remove(alarmId).isPresent()) {
                    removed++;
                    LOG.info("Removed alarm {}", alarmId);
                } else {
                    allRemoved = false;
                    LOG.warn("Alarm {} not found; nothing removed", alarmId);
                }
            }
            if (removed > 0) {
                store.save();
                notifications.notifyAlarmList(store.getAll());
            }
            return allRemoved;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Alarm> getAlarms() {
        lock.lock();
        try {
            return store.getAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onTrigger(String alarmId, Instant scheduledAt) {
        ThreadContext.put(MDC_ALARM_ID, alarmId);
        try {
            Optional<Alarm> alarm;
            lock.lock();
            try {
                alarm = store.get(alarmId);
            } finally {
                lock.unlock();
            }

            GlobalMode mode = settings.getGlobalSchedule();
            GateDecision decision = gate.evaluate(alarm, mode);
            metrics.recordTrigger(decision.name());

            if (!decision.plays()) {
                switch (decision) {
                    case BLOCKED_MISSING -> LOG.info("Alarm {} fired at {} but no longer exists", alarmId, scheduledAt);
                    case BLOCKED_OFF -> LOG.info("Alarm {} blocked: global schedule is off", alarmId);
                    case BLOCKED_SCHEDULE_MISMATCH -> LOG.info("Alarm {} blocked: belongs to schedule {}, active schedule is {}",
                            alarmId, alarm.get().scheduleTag(), mode);
                    default -> LOG.info("Alarm {} blocked: inactive", alarmId);
                }
                return;
            }

            LOG.info("Alarm {} triggered: {}", alarmId, alarm.get().describe());
            if (!audio.playAlarm()) {
                LOG.warn("Alarm {} passed the gate but could not start playback", alarmId);
            }
        } finally {
            ThreadContext.remove(MDC_ALARM_ID);
        }
    }

    /**
     * Loads the snapshot and schedules every alarm in it.
     */
    @Override
    public void start() {
        lock.lock();
        try {
            Map<String, Alarm> loaded = store.load();
            int scheduled = scheduler.rescheduleAll(loaded.values());
            LOG.info("Alarm coordinator started: {} alarms loaded, {} scheduled", loaded.size(), scheduled);
            running = true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void stop() {
        lock.lock();
        try {
            scheduler.unscheduleAll();
            running = false;
            LOG.info("Alarm coordinator stopped; all jobs cancelled");
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
