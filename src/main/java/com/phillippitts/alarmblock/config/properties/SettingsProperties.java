package com.phillippitts.alarmblock.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Location and first-run defaults of the global settings file (schedule selector and volumes).
 */
@ConfigurationProperties(prefix = "settings")
@Validated
public class SettingsProperties {

    @NotNull
    private Path path = Paths.get(System.getProperty("user.home"),
            ".local", "share", "alarm-block", "data", "settings.json");

    @Min(0)
    @Max(100)
    private int defaultVolume = 25;

    @Min(0)
    @Max(100)
    private int defaultAlarmVolume = 75;

    /** One of a, b, off. */
    @NotBlank
    private String defaultSchedule = "a";

    public Path getPath() {
        return path;
    }

    public void setPath(Path path) {
        this.path = path;
    }

    public int getDefaultVolume() {
        return defaultVolume;
    }

    public void setDefaultVolume(int defaultVolume) {
        this.defaultVolume = defaultVolume;
    }

    public int getDefaultAlarmVolume() {
        return defaultAlarmVolume;
    }

    public void setDefaultAlarmVolume(int defaultAlarmVolume) {
        this.defaultAlarmVolume = defaultAlarmVolume;
    }

    public String getDefaultSchedule() {
        return defaultSchedule;
    }

    public void setDefaultSchedule(String defaultSchedule) {
        this.defaultSchedule = defaultSchedule;
    }
}
