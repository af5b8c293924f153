package com.phillippitts.alarmblock.service.alarm;

import com.phillippitts.alarmblock.domain.Alarm;
import com.phillippitts.alarmblock.exception.SchedulingException;
import com.phillippitts.alarmblock.service.metrics.AlarmMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link TriggerScheduler} built on a Spring {@link TaskScheduler} and {@link CronExpression}.
 *
 * <p>Each alarm owns one job that is armed as a one-shot task for the next cron match. When the
 * task runs it checks how late it is: within the misfire grace window the handler is invoked,
 * beyond it the fire is skipped with a warning. Either way the job re-arms for the next match
 * strictly after the due instant, so a job never fires twice for the same minute.
 *
 * <p><b>Thread Safety:</b> job registration uses a concurrent map; each job guards its own
 * future with its monitor. Replacing or removing a job cancels the old future before returning.
 *
 * @since 1.0
 */
public class DefaultTriggerScheduler implements TriggerScheduler {

    private static final Logger LOG = LogManager.getLogger(DefaultTriggerScheduler.class);

    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final ZoneId zone;
    private final Duration misfireGrace;
    private final AlarmMetrics metrics;

    private final ConcurrentMap<String, ScheduledJob> jobs = new ConcurrentHashMap<>();
    private volatile TriggerHandler handler;

    /**
     * @param taskScheduler executes armed jobs on its own threads
     * @param clock         source of "now" for arming and lateness checks
     * @param zone          zone the alarm wall-clock times are interpreted in
     * @param misfireGrace  maximum lateness at which a fire still sounds
     * @param metrics       misfire counter
     */
    public DefaultTriggerScheduler(TaskScheduler taskScheduler,
                                   Clock clock,
                                   ZoneId zone,
                                   Duration misfireGrace,
                                   AlarmMetrics metrics) {
        this.taskScheduler = Objects.requireNonNull(taskScheduler, "taskScheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.misfireGrace = Objects.requireNonNull(misfireGrace, "misfireGrace must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        if (misfireGrace.isNegative()) {
            throw new IllegalArgumentException("misfireGrace must not be negative");
        }
    }

    @Override
    public void setTriggerHandler(TriggerHandler handler) {
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
    }

    @Override
    public void schedule(Alarm alarm) {
        Objects.requireNonNull(alarm, "alarm must not be null");
        String alarmId = alarm.id();

        String expression;
        CronExpression cron;
        try {
            expression = AlarmCronExpressions.toCron(alarm);
            cron = CronExpression.parse(expression);
        } catch (IllegalArgumentException e) {
            unschedule(alarmId);
            throw new SchedulingException(alarmId, "invalid cron specification", e);
        }

        ScheduledJob job = new ScheduledJob(alarmId, cron, expression);
        ScheduledJob previous = jobs.put(alarmId, job);
        if (previous != null) {
            previous.cancel();
            LOG.debug("Replaced existing job for alarm {}", alarmId);
        }

        try {
            job.arm(ZonedDateTime.ofInstant(clock.instant(), zone));
        } catch (RuntimeException e) {
            jobs.remove(alarmId, job);
            job.cancel();
            if (e instanceof SchedulingException se) {
                throw se;
            }
            throw new SchedulingException(alarmId, "timer rejected job", e);
        }
        LOG.info("Scheduled alarm {} [{}] ({}), next fire at {}",
                alarmId, expression, zone, job.nextFire().orElse(null));
    }

    @Override
    public boolean unschedule(String alarmId) {
        if (alarmId == null) {
            return false;
        }
        ScheduledJob job = jobs.remove(alarmId);
        if (job == null) {
            LOG.debug("No existing schedule for alarm {}", alarmId);
            return false;
        }
        job.cancel();
        LOG.info("Removed alarm schedule: {}", alarmId);
        return true;
    }

    @Override
    public int rescheduleAll(Collection<Alarm> alarms) {
        unscheduleAll();
        int scheduled = 0;
        for (Alarm alarm : alarms) {
            try {
                schedule(alarm);
                scheduled++;
            } catch (RuntimeException e) {
                LOG.error("Failed to schedule alarm {}: {}", alarm.id(), e.getMessage());
            }
        }
        LOG.info("All alarms scheduled: {}/{}", scheduled, alarms.size());
        return scheduled;
    }

    @Override
    public void unscheduleAll() {
        for (String alarmId : Set.copyOf(jobs.keySet())) {
            unschedule(alarmId);
        }
    }

    @Override
    public boolean isScheduled(String alarmId) {
        return alarmId != null && jobs.containsKey(alarmId);
    }

    @Override
    public Optional<Instant> nextFireTime(String alarmId) {
        if (alarmId == null) {
            return Optional.empty();
        }
        ScheduledJob job = jobs.get(alarmId);
        return job == null ? Optional.empty() : job.nextFire();
    }

    @Override
    public Set<String> scheduledIds() {
        return Set.copyOf(jobs.keySet());
    }

    private void deliver(String alarmId, Instant due) {
        TriggerHandler current = handler;
        if (current == null) {
            LOG.warn("Alarm {} fired but no trigger handler is registered", alarmId);
            return;
        }
        try {
            current.onTrigger(alarmId, due);
            LOG.info("Job completed: {}", alarmId);
        } catch (RuntimeException e) {
            LOG.error("Job failed: {}", alarmId, e);
        }
    }

    /**
     * One alarm's recurring timer. Armed as a chain of one-shot tasks.
     */
    private final class ScheduledJob {
        private final String alarmId;
        private final CronExpression cron;
        private final String expression;

        private ScheduledFuture<?> future;
        private Instant nextFire;
        private boolean cancelled;

        ScheduledJob(String alarmId, CronExpression cron, String expression) {
            this.alarmId = alarmId;
            this.cron = cron;
            this.expression = expression;
        }

        synchronized void arm(ZonedDateTime after) {
            if (cancelled) {
                return;
            }
            ZonedDateTime next = cron.next(after);
            if (next == null) {
                throw new SchedulingException(alarmId, "cron " + expression + " never matches", null);
            }
            Instant due = next.toInstant();
            nextFire = due;
            future = taskScheduler.schedule(() -> fire(due), due);
        }

        synchronized void cancel() {
            cancelled = true;
            nextFire = null;
            if (future != null) {
                future.cancel(false);
                future = null;
            }
        }

        synchronized boolean isCancelled() {
            return cancelled;
        }

        synchronized Optional<Instant> nextFire() {
            return Optional.ofNullable(nextFire);
        }

        void fire(Instant due) {
            if (isCancelled()) {
                return;
            }
            Instant now = clock.instant();
            Duration lateness = Duration.between(due, now);
            if (lateness.compareTo(misfireGrace) > 0) {
                metrics.recordMisfire();
                LOG.warn("Alarm {} missed its fire time {} by {}s (grace {}s); skipping this occurrence",
                        alarmId, due, lateness.toSeconds(), misfireGrace.toSeconds());
            } else {
                deliver(alarmId, due);
            }

            Instant base = now.isAfter(due) ? now : due;
            try {
                arm(ZonedDateTime.ofInstant(base, zone));
            } catch (RuntimeException e) {
                jobs.remove(alarmId, this);
                LOG.error("Failed to re-arm alarm {}; it will not fire again until rescheduled", alarmId, e);
            }
        }
    }
}
