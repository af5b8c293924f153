package com.phillippitts.alarmblock.service.audio.javasound;

import com.phillippitts.alarmblock.exception.AudioPlaybackException;
import com.phillippitts.alarmblock.service.audio.PlaybackChannel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.BooleanControl;
import javax.sound.sampled.Clip;
import javax.sound.sampled.FloatControl;
import javax.sound.sampled.LineUnavailableException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pool slot that plays one in-memory sound through a {@link Clip}.
 */
final class JavaSoundChannel implements PlaybackChannel {

    private static final Logger LOG = LogManager.getLogger(JavaSoundChannel.class);

    private final int id;
    private final JavaSoundSource source;
    private final AtomicBoolean busy = new AtomicBoolean(false);

    private Clip clip;
    private int volume = 100;

    JavaSoundChannel(int id, JavaSoundSource source) {
        this.id = id;
        this.source = source;
    }

    boolean reserve() {
        return busy.compareAndSet(false, true);
    }

    @Override
    public int id() {
        return id;
    }

    @Override
    public synchronized void play(String soundKey, boolean loop) {
        JavaSoundSource.LoadedSound sound = source.sound(soundKey)
                .orElseThrow(() -> new AudioPlaybackException(String.valueOf(soundKey), "sound not loaded", null));
        closeClip();
        try {
            Clip opened = AudioSystem.getClip();
            opened.open(sound.format(), sound.data(), 0, sound.data().length);
            applyVolume(opened, volume);
            if (loop) {
                opened.loop(Clip.LOOP_CONTINUOUSLY);
            } else {
                opened.start();
            }
            clip = opened;
        } catch (LineUnavailableException | IllegalArgumentException | SecurityException e) {
            throw new AudioPlaybackException(soundKey, e.getMessage(), e);
        }
    }

    @Override
    public synchronized void setVolume(int percent) {
        volume = Math.max(0, Math.min(100, percent));
        if (clip != null) {
            applyVolume(clip, volume);
        }
    }

    /**
     * Maps a 0-100 percentage onto the clip's gain in decibels; 0 is the control's minimum.
     */
    static void applyVolume(Clip target, int percent) {
        if (target.isControlSupported(FloatControl.Type.MASTER_GAIN)) {
            FloatControl gain = (FloatControl) target.getControl(FloatControl.Type.MASTER_GAIN);
            float db = percent <= 0 ? gain.getMinimum() : (float) (20.0 * Math.log10(percent / 100.0));
            gain.setValue(Math.max(gain.getMinimum(), Math.min(gain.getMaximum(), db)));
        } else if (target.isControlSupported(BooleanControl.Type.MUTE)) {
            BooleanControl mute = (BooleanControl) target.getControl(BooleanControl.Type.MUTE);
            mute.setValue(percent <= 0);
        } else {
            LOG.debug("Clip on channel supports neither gain nor mute; volume ignored");
        }
    }

    @Override
    public synchronized void stop() {
        closeClip();
        busy.set(false);
    }

    private void closeClip() {
        if (clip != null) {
            clip.stop();
            clip.close();
            clip = null;
        }
    }

    @Override
    public boolean isBusy() {
        return busy.get();
    }
}
