package com.phillippitts.alarmblock.service.audio.javasound;

import com.phillippitts.alarmblock.config.properties.AudioProperties;
import com.phillippitts.alarmblock.service.audio.PlaybackChannel;
import com.phillippitts.alarmblock.service.audio.SoundSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link SoundSource} backed by {@code javax.sound.sampled}.
 *
 * <p>All sounds are decoded into memory at construction:
 * <ul>
 *   <li>every supported file in {@code sounds-dir/alarm-sounds-dir} becomes an alarm sound;</li>
 *   <li>if none loads, {@code sounds-dir/default-alarm-sound} is used instead;</li>
 *   <li>{@code sounds-dir/ambient-sound} is the ambient track.</li>
 * </ul>
 * Unreadable files are skipped with a warning. Sound keys are paths relative to the sounds
 * directory, e.g. {@code alarms/birds.wav}.
 *
 * <p>Each playback opens a fresh {@link javax.sound.sampled.Clip} on the default mixer; the
 * channel pool caps how many are open at once.
 */
public class JavaSoundSource implements SoundSource {

    private static final Logger LOG = LogManager.getLogger(JavaSoundSource.class);

    public static final String MODE = "javasound";

    /**
     * Decoded PCM data plus the format needed to open a clip on it.
     */
    record LoadedSound(AudioFormat format, byte[] data) {
    }

    private final Path soundsDir;
    private final List<String> supportedExtensions;
    private final Map<String, LoadedSound> sounds = new LinkedHashMap<>();
    private final List<String> alarmKeys;
    private final String ambientKey;
    private final List<JavaSoundChannel> channels;

    public JavaSoundSource(AudioProperties props) {
        Objects.requireNonNull(props, "props must not be null");
        this.soundsDir = props.getSoundsDir();
        this.supportedExtensions = props.getSupportedExtensions().stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());

        this.alarmKeys = List.copyOf(loadAlarmSounds(props));
        this.ambientKey = loadInto(soundsDir.resolve(props.getAmbientSound())).orElse(null);
        if (ambientKey == null) {
            LOG.warn("Ambient sound not available: {}", soundsDir.resolve(props.getAmbientSound()));
        }

        List<JavaSoundChannel> pool = new ArrayList<>(props.getChannels());
        for (int i = 0; i < props.getChannels(); i++) {
            pool.add(new JavaSoundChannel(i, this));
        }
        this.channels = List.copyOf(pool);
        LOG.info("Java Sound output: {} alarm sounds, ambient={}, {} channels",
                alarmKeys.size(), ambientKey, channels.size());
    }

    private List<String> loadAlarmSounds(AudioProperties props) {
        Path alarmDir = soundsDir.resolve(props.getAlarmSoundsDir());
        List<String> keys = new ArrayList<>();
        if (Files.isDirectory(alarmDir)) {
            try (Stream<Path> files = Files.list(alarmDir)) {
                List<Path> candidates = files
                        .filter(Files::isRegularFile)
                        .filter(this::hasSupportedExtension)
                        .sorted()
                        .collect(Collectors.toList());
                for (Path file : candidates) {
                    loadInto(file).ifPresent(keys::add);
                }
            } catch (IOException e) {
                LOG.error("Failed to list alarm sounds in {}: {}", alarmDir, e.toString());
            }
        } else {
            LOG.warn("Alarm sounds directory not found: {}", alarmDir);
        }

        if (keys.isEmpty()) {
            Path fallback = soundsDir.resolve(props.getDefaultAlarmSound());
            LOG.warn("No alarm sounds loaded from {}; falling back to {}", alarmDir, fallback);
            loadInto(fallback).ifPresent(keys::add);
        }
        if (keys.isEmpty()) {
            LOG.error("No alarm sound could be loaded; alarms will not be audible");
        }
        return keys;
    }

    private boolean hasSupportedExtension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && supportedExtensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private Optional<String> loadInto(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try (AudioInputStream in = AudioSystem.getAudioInputStream(file.toFile())) {
            LoadedSound sound = new LoadedSound(in.getFormat(), in.readAllBytes());
            String key = soundsDir.relativize(file).toString().replace('\\', '/');
            sounds.put(key, sound);
            LOG.debug("Loaded sound {} ({} bytes, {})", key, sound.data().length, sound.format());
            return Optional.of(key);
        } catch (UnsupportedAudioFileException | IOException e) {
            LOG.warn("Skipping unreadable sound file {}: {}", file, e.toString());
            return Optional.empty();
        }
    }

    Optional<LoadedSound> sound(String key) {
        return Optional.ofNullable(key == null ? null : sounds.get(key));
    }

    @Override
    public List<String> alarmSoundKeys() {
        return alarmKeys;
    }

    @Override
    public Optional<String> ambientSoundKey() {
        return Optional.ofNullable(ambientKey);
    }

    @Override
    public Optional<PlaybackChannel> acquireChannel() {
        for (JavaSoundChannel channel : channels) {
            if (channel.reserve()) {
                return Optional.of(channel);
            }
        }
        return Optional.empty();
    }

    @Override
    public int channelCount() {
        return channels.size();
    }

    @Override
    public String mode() {
        return MODE;
    }

    @Override
    public void close() {
        channels.forEach(JavaSoundChannel::stop);
        LOG.info("Java Sound output closed");
    }
}
