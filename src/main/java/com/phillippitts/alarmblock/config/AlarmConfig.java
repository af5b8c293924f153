package com.phillippitts.alarmblock.config;

import com.phillippitts.alarmblock.config.properties.AlarmProperties;
import com.phillippitts.alarmblock.service.alarm.AlarmStore;
import com.phillippitts.alarmblock.service.alarm.DefaultAlarmCoordinator;
import com.phillippitts.alarmblock.service.alarm.DefaultTriggerScheduler;
import com.phillippitts.alarmblock.service.alarm.TriggerGate;
import com.phillippitts.alarmblock.service.alarm.TriggerScheduler;
import com.phillippitts.alarmblock.service.audio.AudioCoordinator;
import com.phillippitts.alarmblock.service.metrics.AlarmMetrics;
import com.phillippitts.alarmblock.service.notification.NotificationSink;
import com.phillippitts.alarmblock.service.settings.SettingsProvider;
import com.phillippitts.alarmblock.service.validation.AlarmValidator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;

/**
 * Wires the alarm side of the application: store, scheduler, gate and coordinator.
 * Each is created exactly once here and injected wherever it is needed.
 */
@Configuration
public class AlarmConfig {

    private final AlarmProperties alarmProperties;
    private final AlarmMetrics metrics;

    public AlarmConfig(AlarmProperties alarmProperties, AlarmMetrics metrics) {
        this.alarmProperties = alarmProperties;
        this.metrics = metrics;
    }

    @Bean
    public Clock alarmClock() {
        return Clock.system(alarmProperties.resolveZone());
    }

    @Bean
    public AlarmStore alarmStore(AlarmValidator validator) {
        return new AlarmStore(alarmProperties.getStorePath(), validator, metrics);
    }

    /**
     * Cron-driven trigger scheduler running on the dedicated alarm task scheduler.
     */
    @Bean
    public TriggerScheduler triggerScheduler(@Qualifier("alarmTaskScheduler") TaskScheduler taskScheduler,
                                             Clock alarmClock) {
        return new DefaultTriggerScheduler(taskScheduler, alarmClock, alarmProperties.resolveZone(),
                alarmProperties.getMisfireGrace(), metrics);
    }

    @Bean
    public TriggerGate triggerGate() {
        return new TriggerGate();
    }

    /**
     * Alarm coordinator. Started by the container once every bean exists, so the snapshot is
     * loaded and scheduled only after the audio side is ready.
     */
    @Bean
    public DefaultAlarmCoordinator alarmCoordinator(AlarmStore alarmStore,
                                                    TriggerScheduler triggerScheduler,
                                                    SettingsProvider settingsProvider,
                                                    AudioCoordinator audioCoordinator,
                                                    NotificationSink notificationSink,
                                                    AlarmValidator validator,
                                                    TriggerGate triggerGate) {
        return new DefaultAlarmCoordinator(alarmStore, triggerScheduler, settingsProvider, audioCoordinator,
                notificationSink, validator, metrics, triggerGate);
    }
}
