package com.phillippitts.alarmblock.service.health;

import com.phillippitts.alarmblock.service.audio.AudioCoordinator;
import com.phillippitts.alarmblock.service.audio.AudioStatus;
import com.phillippitts.alarmblock.service.audio.SoundSource;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the audio output.
 *
 * <ul>
 *   <li>UP: at least one alarm sound is loaded</li>
 *   <li>DOWN: no alarm sound loaded, alarms would fire silently</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class AudioOutputHealthIndicator implements HealthIndicator {

    private final SoundSource soundSource;
    private final AudioCoordinator audioCoordinator;

    public AudioOutputHealthIndicator(SoundSource soundSource, AudioCoordinator audioCoordinator) {
        this.soundSource = soundSource;
        this.audioCoordinator = audioCoordinator;
    }

    @Override
    public Health health() {
        int alarmSounds = soundSource.alarmSoundKeys().size();
        AudioStatus status = audioCoordinator.getStatus();

        Health.Builder builder = alarmSounds > 0
                ? Health.up().withDetail("status", "Alarm sounds loaded")
                : Health.down().withDetail("status", "No alarm sound available");

        return builder
                .withDetail("mode", soundSource.mode())
                .withDetail("channels", soundSource.channelCount())
                .withDetail("alarmSounds", alarmSounds)
                .withDetail("ambientAvailable", soundSource.ambientSoundKey().isPresent())
                .withDetail("alarmPlaying", status.alarmPlaying())
                .withDetail("ambientPlaying", status.ambientPlaying())
                .build();
    }
}
