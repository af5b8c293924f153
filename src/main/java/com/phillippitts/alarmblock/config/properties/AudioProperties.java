package com.phillippitts.alarmblock.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Audio output configuration: which sound source backs playback, where sounds live,
 * how many channels the pool has and how far ambient sound is ducked under an alarm.
 */
@ConfigurationProperties(prefix = "audio")
@Validated
public class AudioProperties {

    public enum OutputMode { JAVASOUND, SIMULATED }

    /** Sound source implementation, chosen once at startup. */
    @NotNull
    private OutputMode mode = OutputMode.SIMULATED;

    /** Directory holding the ambient track and the default alarm sound. */
    @NotNull
    private Path soundsDir = Paths.get(System.getProperty("user.home"),
            ".local", "share", "alarm-block", "sounds");

    /** Subdirectory of {@link #soundsDir} scanned for the alarm sound pool. */
    @NotNull
    private String alarmSoundsDir = "alarms";

    @NotNull
    private String ambientSound = "white_noise.wav";

    /** Fallback used when the alarm sound pool is empty. */
    @NotNull
    private String defaultAlarmSound = "default_alarm.wav";

    /** File extensions the real sound source attempts to load. */
    @NotEmpty
    private List<String> supportedExtensions = new ArrayList<>(List.of("wav", "aiff", "aif", "au"));

    /** Size of the playback channel pool. */
    @Min(2)
    @Max(32)
    private int channels = 8;

    /** Highest volume ambient sound may play at while the alarm sounds (0 mutes it). */
    @Min(0)
    @Max(100)
    private int duckingCeiling = 0;

    /** Alarm sound keys offered by the simulated source. */
    @NotEmpty
    private List<String> simulatedAlarmSounds = new ArrayList<>(List.of("alarm_default"));

    public OutputMode getMode() {
        return mode;
    }

    public void setMode(OutputMode mode) {
        this.mode = mode;
    }

    public Path getSoundsDir() {
        return soundsDir;
    }

    public void setSoundsDir(Path soundsDir) {
        this.soundsDir = soundsDir;
    }

    public String getAlarmSoundsDir() {
        return alarmSoundsDir;
    }

    public void setAlarmSoundsDir(String alarmSoundsDir) {
        this.alarmSoundsDir = alarmSoundsDir;
    }

    public String getAmbientSound() {
        return ambientSound;
    }

    public void setAmbientSound(String ambientSound) {
        this.ambientSound = ambientSound;
    }

    public String getDefaultAlarmSound() {
        return defaultAlarmSound;
    }

    public void setDefaultAlarmSound(String defaultAlarmSound) {
        this.defaultAlarmSound = defaultAlarmSound;
    }

    public List<String> getSupportedExtensions() {
        return supportedExtensions;
    }

    public void setSupportedExtensions(List<String> supportedExtensions) {
        this.supportedExtensions = supportedExtensions;
    }

    public int getChannels() {
        return channels;
    }

    public void setChannels(int channels) {
        this.channels = channels;
    }

    public int getDuckingCeiling() {
        return duckingCeiling;
    }

    public void setDuckingCeiling(int duckingCeiling) {
        this.duckingCeiling = duckingCeiling;
    }

    public List<String> getSimulatedAlarmSounds() {
        return simulatedAlarmSounds;
    }

    public void setSimulatedAlarmSounds(List<String> simulatedAlarmSounds) {
        this.simulatedAlarmSounds = simulatedAlarmSounds;
    }
}
