package com.phillippitts.alarmblock.config.audio;

import com.phillippitts.alarmblock.config.properties.AudioProperties;
import com.phillippitts.alarmblock.service.audio.DefaultAudioCoordinator;
import com.phillippitts.alarmblock.service.audio.SoundSource;
import com.phillippitts.alarmblock.service.audio.javasound.JavaSoundSource;
import com.phillippitts.alarmblock.service.audio.simulated.SimulatedSoundSource;
import com.phillippitts.alarmblock.service.metrics.AlarmMetrics;
import com.phillippitts.alarmblock.service.notification.NotificationSink;
import com.phillippitts.alarmblock.service.settings.SettingsProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the audio backend once at startup from {@code audio.mode} and builds the coordinator
 * on top of it. The coordinator owns the sound source and closes it on shutdown.
 */
@Configuration
public class AudioOutputConfig {

    /**
     * Real output through the default Java Sound mixer. Active when audio.mode=javasound.
     */
    @Bean(destroyMethod = "")
    @ConditionalOnProperty(prefix = "audio", name = "mode", havingValue = "javasound")
    public SoundSource javaSoundSource(AudioProperties props) {
        return new JavaSoundSource(props);
    }

    /**
     * Silent output. Active when audio.mode=simulated or missing.
     */
    @Bean(destroyMethod = "")
    @ConditionalOnProperty(
            prefix = "audio",
            name = "mode",
            havingValue = "simulated",
            matchIfMissing = true
    )
    public SoundSource simulatedSoundSource(AudioProperties props) {
        return new SimulatedSoundSource(props.getSimulatedAlarmSounds(), props.getAmbientSound(),
                props.getChannels());
    }

    @Bean
    public DefaultAudioCoordinator audioCoordinator(SoundSource soundSource,
                                                    SettingsProvider settingsProvider,
                                                    NotificationSink notificationSink,
                                                    AlarmMetrics metrics,
                                                    AudioProperties props) {
        return new DefaultAudioCoordinator(soundSource, settingsProvider, notificationSink, metrics,
                props.getDuckingCeiling());
    }
}
