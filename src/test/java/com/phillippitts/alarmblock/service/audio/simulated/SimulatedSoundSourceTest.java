package com.phillippitts.alarmblock.service.audio.simulated;

import com.phillippitts.alarmblock.exception.AudioPlaybackException;
import com.phillippitts.alarmblock.service.audio.PlaybackChannel;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimulatedSoundSourceTest {

    private final SimulatedSoundSource source =
            new SimulatedSoundSource(List.of("beep", "chime"), "rain", 2);

    @Test
    void shouldReportConfiguredSounds() {
        assertThat(source.alarmSoundKeys()).containsExactly("beep", "chime");
        assertThat(source.ambientSoundKey()).contains("rain");
        assertThat(source.channelCount()).isEqualTo(2);
        assertThat(source.mode()).isEqualTo("simulated");
    }

    @Test
    void blankAmbientShouldMeanNoAmbient() {
        assertThat(new SimulatedSoundSource(List.of("beep"), " ", 1).ambientSoundKey()).isEmpty();
    }

    @Test
    void acquireShouldFailFastWhenPoolExhausted() {
        Optional<PlaybackChannel> first = source.acquireChannel();
        Optional<PlaybackChannel> second = source.acquireChannel();

        assertThat(first).isPresent();
        assertThat(second).isPresent();
        assertThat(source.acquireChannel()).isEmpty();

        first.get().stop();
        assertThat(source.acquireChannel()).isPresent();
    }

    @Test
    void channelShouldRecordPlaybackAndClampVolume() {
        PlaybackChannel channel = source.acquireChannel().orElseThrow();

        channel.setVolume(150);
        channel.play("chime", true);

        SimulatedSoundSource.SimulatedChannel simulated = source.channels().get(channel.id());
        assertThat(simulated.playing()).isEqualTo("chime");
        assertThat(simulated.looping()).isTrue();
        assertThat(simulated.volume()).isEqualTo(100);

        channel.setVolume(-5);
        assertThat(simulated.volume()).isZero();
    }

    @Test
    void unknownSoundShouldFailToPlay() {
        PlaybackChannel channel = source.acquireChannel().orElseThrow();

        assertThatThrownBy(() -> channel.play("missing", false))
                .isInstanceOf(AudioPlaybackException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void closeShouldReleaseEveryChannel() {
        source.acquireChannel().orElseThrow().play("beep", true);
        source.acquireChannel();

        source.close();

        assertThat(source.channels()).noneMatch(PlaybackChannel::isBusy);
        assertThat(source.channels()).allMatch(c -> c.playing() == null);
    }

    @Test
    void zeroChannelsShouldBeRejected() {
        assertThatThrownBy(() -> new SimulatedSoundSource(List.of(), null, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
