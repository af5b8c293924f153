package com.phillippitts.alarmblock.exception;

/**
 * Thrown by a playback channel when the output device refuses to start a sound.
 *
 * <p>Never surfaces past the audio coordinator: a failed start is reported there as {@code false}.
 */
public class AudioPlaybackException extends AlarmBlockException {

    private final String soundKey;

    public AudioPlaybackException(String soundKey, String message, Throwable cause) {
        super("Failed to play " + soundKey + ": " + message, cause);
        this.soundKey = soundKey;
    }

    public String getSoundKey() {
        return soundKey;
    }
}
