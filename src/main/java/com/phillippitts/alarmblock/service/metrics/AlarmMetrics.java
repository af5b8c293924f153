package com.phillippitts.alarmblock.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Centralized metrics tracking for alarm triggers and audio playback.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Trigger outcomes (played, blocked by mode, schedule or inactive flag, missing alarm)</li>
 *   <li>Fires skipped because they ran later than the misfire grace window</li>
 *   <li>Playback failures per channel (no free channel, no sound, device error)</li>
 *   <li>Persistence failures per snapshot (alarms, settings)</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class AlarmMetrics {

    private static final String METRIC_PREFIX = "alarmblock";

    private final MeterRegistry registry;

    public AlarmMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Increments the trigger counter for one gate outcome.
     *
     * @param outcome gate decision name (PLAY, BLOCKED_OFF, ...)
     */
    public void recordTrigger(String outcome) {
        Counter.builder(METRIC_PREFIX + ".alarm.trigger")
                .description("Number of alarm fires by gate outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Increments the counter of fires skipped for running too late.
     */
    public void recordMisfire() {
        Counter.builder(METRIC_PREFIX + ".alarm.misfire")
                .description("Number of alarm fires skipped outside the misfire grace window")
                .register(registry)
                .increment();
    }

    /**
     * Increments the playback failure counter.
     *
     * @param channel logical channel (alarm, ambient)
     * @param reason failure reason (no_channel, no_sound, playback_error)
     */
    public void recordPlaybackFailure(String channel, String reason) {
        Counter.builder(METRIC_PREFIX + ".audio.playback.failure")
                .description("Number of failed playback starts")
                .tag("channel", channel)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Increments the persistence failure counter.
     *
     * @param target snapshot that failed (alarms, settings)
     */
    public void recordPersistenceFailure(String target) {
        Counter.builder(METRIC_PREFIX + ".persistence.failure")
                .description("Number of failed snapshot reads or writes")
                .tag("target", target)
                .register(registry)
                .increment();
    }
}
