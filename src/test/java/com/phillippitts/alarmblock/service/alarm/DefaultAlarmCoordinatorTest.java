package com.phillippitts.alarmblock.service.alarm;

import com.phillippitts.alarmblock.domain.Alarm;
import com.phillippitts.alarmblock.domain.GlobalMode;
import com.phillippitts.alarmblock.domain.ScheduleTag;
import com.phillippitts.alarmblock.exception.SchedulingException;
import com.phillippitts.alarmblock.exception.ValidationException;
import com.phillippitts.alarmblock.service.audio.AudioCoordinator;
import com.phillippitts.alarmblock.service.audio.DefaultAudioCoordinator;
import com.phillippitts.alarmblock.service.audio.simulated.SimulatedSoundSource;
import com.phillippitts.alarmblock.service.audio.simulated.SimulatedSoundSource.SimulatedChannel;
import com.phillippitts.alarmblock.service.metrics.AlarmMetrics;
import com.phillippitts.alarmblock.service.validation.AlarmValidator;
import com.phillippitts.alarmblock.testutil.InMemorySettingsProvider;
import com.phillippitts.alarmblock.testutil.ManualTaskScheduler;
import com.phillippitts.alarmblock.testutil.MutableClock;
import com.phillippitts.alarmblock.testutil.RecordingNotificationSink;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultAlarmCoordinatorTest {

    // 2024-01-01 is a Monday
    private static final Instant MONDAY_0700 = Instant.parse("2024-01-01T07:00:00Z");

    @TempDir
    Path tempDir;

    private Path file;
    private SimpleMeterRegistry registry;
    private AlarmMetrics metrics;
    private AlarmValidator validator;
    private AlarmStore store;
    private ManualTaskScheduler taskScheduler;
    private MutableClock clock;
    private DefaultTriggerScheduler scheduler;
    private InMemorySettingsProvider settings;
    private AudioCoordinator audio;
    private RecordingNotificationSink sink;
    private DefaultAlarmCoordinator coordinator;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("alarms.json");
        registry = new SimpleMeterRegistry();
        metrics = new AlarmMetrics(registry);
        validator = new AlarmValidator();
        store = new AlarmStore(file, validator, metrics);
        taskScheduler = new ManualTaskScheduler();
        clock = new MutableClock(MONDAY_0700, ZoneOffset.UTC);
        scheduler = new DefaultTriggerScheduler(taskScheduler.scheduler(), clock, ZoneOffset.UTC,
                Duration.ofSeconds(60), metrics);
        settings = new InMemorySettingsProvider(GlobalMode.A, 25, 75);
        audio = mock(AudioCoordinator.class);
        when(audio.playAlarm()).thenReturn(true);
        sink = new RecordingNotificationSink();
        coordinator = new DefaultAlarmCoordinator(store, scheduler, settings, audio, sink, validator, metrics,
                new TriggerGate());
    }

    private static Alarm alarm(String id, ScheduleTag tag, boolean active) {
        return Alarm.of(id, 7, 30, List.of(0), tag, active);
    }

    private double triggers(GateDecision outcome) {
        return registry.counter("alarmblock.alarm.trigger", "outcome", outcome.name()).count();
    }

    @Test
    void setAlarmShouldStoreScheduleAndPersist() {
        Alarm alarm = alarm("wake", ScheduleTag.A, true);

        Alarm stored = coordinator.setAlarm(alarm);

        assertThat(stored).isEqualTo(alarm);
        assertThat(coordinator.getAlarms()).containsExactly(alarm);
        assertThat(scheduler.isScheduled("wake")).isTrue();
        assertThat(new AlarmStore(file, validator, metrics).load()).containsEntry("wake", alarm);
        assertThat(sink.alarmLists).containsExactly(List.of(alarm));
    }

    @Test
    void setAlarmShouldGenerateMissingId() {
        Alarm stored = coordinator.setAlarm(Alarm.of(null, 6, 0, List.of(1), ScheduleTag.B, true));

        assertThat(stored.hasId()).isTrue();
        assertThat(scheduler.isScheduled(stored.id())).isTrue();
        assertThat(store.get(stored.id())).contains(stored);
    }

    @Test
    void invalidAlarmShouldChangeNothing() {
        Alarm invalid = Alarm.of("bad", 24, 0, List.of(0), ScheduleTag.A, true);

        assertThatThrownBy(() -> coordinator.setAlarm(invalid))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("hour");

        assertThat(coordinator.getAlarms()).isEmpty();
        assertThat(scheduler.isScheduled("bad")).isFalse();
        assertThat(Files.exists(file)).isFalse();
        assertThat(sink.alarmLists).isEmpty();
    }

    @Test
    void nullAlarmShouldBeRejected() {
        assertThatThrownBy(() -> coordinator.setAlarm(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void replacingAlarmShouldKeepSingleJob() {
        coordinator.setAlarm(alarm("wake", ScheduleTag.A, true));
        Alarm updated = Alarm.of("wake", 7, 45, List.of(0), ScheduleTag.A, true);

        coordinator.setAlarm(updated);

        assertThat(coordinator.getAlarms()).containsExactly(updated);
        assertThat(scheduler.scheduledIds()).containsExactly("wake");
        assertThat(scheduler.nextFireTime("wake")).contains(Instant.parse("2024-01-01T07:45:00Z"));
    }

    @Test
    void setThenRemoveShouldLeaveNoJob() {
        Alarm alarm = coordinator.setAlarm(alarm("wake", ScheduleTag.A, true));

        boolean removed = coordinator.removeAlarms(List.of(alarm.id()));

        assertThat(removed).isTrue();
        assertThat(scheduler.isScheduled(alarm.id())).isFalse();
        assertThat(scheduler.scheduledIds()).isEmpty();
        assertThat(coordinator.getAlarms()).isEmpty();
        assertThat(new AlarmStore(file, validator, metrics).load()).isEmpty();
    }

    @Test
    void partialRemovalShouldRemoveExistingAndReportFalse() {
        coordinator.setAlarm(alarm("exists", ScheduleTag.A, true));
        coordinator.setAlarm(alarm("keep", ScheduleTag.B, true));
        sink.alarmLists.clear();

        boolean removedAll = coordinator.removeAlarms(List.of("exists", "missing"));

        assertThat(removedAll).isFalse();
        assertThat(store.get("exists")).isEmpty();
        assertThat(scheduler.isScheduled("exists")).isFalse();
        assertThat(coordinator.getAlarms()).extracting(Alarm::id).containsExactly("keep");
        assertThat(sink.alarmLists).hasSize(1);
    }

    @Test
    void removingOnlyMissingIdsShouldNotPersistOrNotify() {
        boolean removedAll = coordinator.removeAlarms(List.of("missing"));

        assertThat(removedAll).isFalse();
        assertThat(Files.exists(file)).isFalse();
        assertThat(sink.alarmLists).isEmpty();
    }

    @Test
    void removingNothingShouldSucceed() {
        assertThat(coordinator.removeAlarms(List.of())).isTrue();
    }

    @Test
    void nullIdListShouldBeRejected() {
        assertThatThrownBy(() -> coordinator.removeAlarms(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void schedulingFailureShouldStillPersistAlarm() {
        TriggerScheduler failing = mock(TriggerScheduler.class);
        doThrow(new SchedulingException("wake", "timer rejected job", null)).when(failing).schedule(any());
        DefaultAlarmCoordinator withFailingScheduler = new DefaultAlarmCoordinator(store, failing, settings, audio,
                sink, validator, metrics, new TriggerGate());
        Alarm alarm = alarm("wake", ScheduleTag.A, true);

        Alarm stored = withFailingScheduler.setAlarm(alarm);

        assertThat(stored).isEqualTo(alarm);
        assertThat(new AlarmStore(file, validator, metrics).load()).containsEntry("wake", alarm);
    }

    @Test
    void triggerShouldPlayWhenScheduleMatchesAndActive() {
        coordinator.setAlarm(alarm("wake", ScheduleTag.A, true));

        coordinator.onTrigger("wake", Instant.now());

        verify(audio).playAlarm();
        assertThat(triggers(GateDecision.PLAY)).isEqualTo(1.0);
    }

    @Test
    void triggerShouldBeBlockedWhenGlobalScheduleOff() {
        coordinator.setAlarm(alarm("wake", ScheduleTag.A, true));
        settings.setGlobalSchedule(GlobalMode.OFF);

        coordinator.onTrigger("wake", Instant.now());

        verify(audio, never()).playAlarm();
        assertThat(triggers(GateDecision.BLOCKED_OFF)).isEqualTo(1.0);
    }

    @Test
    void triggerShouldBeBlockedOnScheduleMismatch() {
        coordinator.setAlarm(alarm("wake", ScheduleTag.B, true));

        coordinator.onTrigger("wake", Instant.now());

        verify(audio, never()).playAlarm();
        assertThat(triggers(GateDecision.BLOCKED_SCHEDULE_MISMATCH)).isEqualTo(1.0);
    }

    @Test
    void triggerShouldBeBlockedWhenInactive() {
        coordinator.setAlarm(alarm("wake", ScheduleTag.A, false));

        coordinator.onTrigger("wake", Instant.now());

        verify(audio, never()).playAlarm();
        assertThat(triggers(GateDecision.BLOCKED_INACTIVE)).isEqualTo(1.0);
    }

    @Test
    void triggerForDeletedAlarmShouldDoNothing() {
        coordinator.onTrigger("gone", Instant.now());

        verify(audio, never()).playAlarm();
        assertThat(triggers(GateDecision.BLOCKED_MISSING)).isEqualTo(1.0);
    }

    @Test
    void triggerShouldTolerateFailedPlayback() {
        when(audio.playAlarm()).thenReturn(false);
        coordinator.setAlarm(alarm("wake", ScheduleTag.A, true));

        coordinator.onTrigger("wake", Instant.now());

        verify(audio).playAlarm();
    }

    @Test
    void triggerShouldCarryAlarmIdInLoggingContext() {
        AtomicReference<String> seen = new AtomicReference<>();
        when(audio.playAlarm()).thenAnswer(invocation -> {
            seen.set(ThreadContext.get("alarmId"));
            return true;
        });
        coordinator.setAlarm(alarm("wake", ScheduleTag.A, true));

        coordinator.onTrigger("wake", Instant.now());

        assertThat(seen.get()).isEqualTo("wake");
        assertThat(ThreadContext.get("alarmId")).isNull();
    }

    @Test
    void firedJobShouldReachCoordinatorThroughScheduler() {
        coordinator.setAlarm(alarm("wake", ScheduleTag.A, true));
        clock.set(Instant.parse("2024-01-01T07:30:00Z"));

        taskScheduler.last().run();

        verify(audio).playAlarm();
    }

    @Test
    void startShouldLoadSnapshotAndScheduleEveryAlarm() {
        AlarmStore seed = new AlarmStore(file, validator, metrics);
        seed.put(alarm("one", ScheduleTag.A, true));
        seed.put(alarm("two", ScheduleTag.B, false));
        seed.save();

        coordinator.start();

        assertThat(coordinator.isRunning()).isTrue();
        assertThat(coordinator.getAlarms()).extracting(Alarm::id).containsExactly("one", "two");
        assertThat(scheduler.scheduledIds()).containsExactlyInAnyOrder("one", "two");
    }

    @Test
    void startWithCorruptSnapshotShouldStartEmpty() throws Exception {
        Files.writeString(file, "{ not an array");

        coordinator.start();

        assertThat(coordinator.isRunning()).isTrue();
        assertThat(coordinator.getAlarms()).isEmpty();
    }

    @Test
    void stopShouldCancelEveryJob() {
        coordinator.setAlarm(alarm("one", ScheduleTag.A, true));
        coordinator.start();

        coordinator.stop();

        assertThat(coordinator.isRunning()).isFalse();
        assertThat(scheduler.scheduledIds()).isEmpty();
    }

    @Test
    void concurrentTriggersAndEditsShouldFinishAndApplyEditsInCallOrder() throws Exception {
        SimulatedSoundSource source = new SimulatedSoundSource(List.of("alarm_one"), "white_noise", 3);
        DefaultAudioCoordinator realAudio = new DefaultAudioCoordinator(source, settings, sink, metrics, 10);
        coordinator = new DefaultAlarmCoordinator(store, scheduler, settings, realAudio, sink, validator, metrics,
                new TriggerGate());
        coordinator.setAlarm(alarm("wake", ScheduleTag.A, true));

        int iterations = 100;
        ExecutorService callers = Executors.newFixedThreadPool(3);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?> triggers = callers.submit(() -> {
                awaitStart(start);
                for (int i = 0; i < iterations; i++) {
                    coordinator.onTrigger("wake", Instant.now());
                }
            });
            Future<?> edits = callers.submit(() -> {
                awaitStart(start);
                for (int i = 0; i < iterations; i++) {
                    coordinator.setAlarm(alarm("wake", ScheduleTag.A, true));
                    coordinator.removeAlarms(List.of("wake"));
                }
            });
            Future<?> controls = callers.submit(() -> {
                awaitStart(start);
                for (int i = 0; i < iterations; i++) {
                    realAudio.stopAlarm();
                    realAudio.setAlarmVolume(i % 101);
                }
            });
            start.countDown();

            triggers.get(30, TimeUnit.SECONDS);
            edits.get(30, TimeUnit.SECONDS);
            controls.get(30, TimeUnit.SECONDS);
        } finally {
            callers.shutdownNow();
        }

        assertThat(coordinator.getAlarms()).isEmpty();
        assertThat(scheduler.isScheduled("wake")).isFalse();
        assertThat(new AlarmStore(file, validator, metrics).load()).isEmpty();

        realAudio.stopAlarm();
        assertThat(source.channels()).noneMatch(SimulatedChannel::isBusy);
        assertThat(realAudio.isAlarmPlaying()).isFalse();
        assertThat(sink.alarmStatus).doesNotContainSequence(true, true).doesNotContainSequence(false, false);
    }

    private static void awaitStart(CountDownLatch start) {
        try {
            start.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
