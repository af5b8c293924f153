package com.phillippitts.alarmblock.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Alarm persistence and trigger scheduling settings.
 *
 * <p>Note: Bean created via {@link com.phillippitts.alarmblock.AlarmBlockApplication} {@code @EnableConfigurationProperties}.
 */
@ConfigurationProperties(prefix = "alarm")
@Validated
public class AlarmProperties {

    /** JSON snapshot of every alarm. */
    @NotNull
    private Path storePath = Paths.get(System.getProperty("user.home"),
            ".local", "share", "alarm-block", "data", "alarms.json");

    /** Time zone alarms are evaluated in; blank means the system default. */
    private String zone = "";

    /** How late a fire may run and still sound. */
    @NotNull
    private Duration misfireGrace = Duration.ofSeconds(60);

    public Path getStorePath() {
        return storePath;
    }

    public void setStorePath(Path storePath) {
        this.storePath = storePath;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Duration getMisfireGrace() {
        return misfireGrace;
    }

    public void setMisfireGrace(Duration misfireGrace) {
        this.misfireGrace = misfireGrace;
    }

    /**
     * Resolves {@link #getZone()} to a {@link ZoneId}, falling back to the system default when blank.
     */
    public ZoneId resolveZone() {
        return (zone == null || zone.isBlank()) ? ZoneId.systemDefault() : ZoneId.of(zone.trim());
    }
}
