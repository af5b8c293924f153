package com.phillippitts.alarmblock.presentation.controller;

import com.phillippitts.alarmblock.domain.Alarm;
import com.phillippitts.alarmblock.domain.ScheduleTag;
import com.phillippitts.alarmblock.exception.ValidationException;
import com.phillippitts.alarmblock.service.alarm.AlarmCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AlarmControllerTest {

    private AlarmCoordinator coordinator;
    private AlarmController controller;

    @BeforeEach
    void setUp() {
        coordinator = mock(AlarmCoordinator.class);
        controller = new AlarmController(coordinator);
    }

    @Test
    void getAlarmsShouldMapEveryAlarm() {
        when(coordinator.getAlarms()).thenReturn(List.of(
                Alarm.of("one", 6, 15, List.of(0, 4), ScheduleTag.B, false)));

        List<AlarmPayload> alarms = controller.getAlarms();

        assertThat(alarms).containsExactly(new AlarmPayload("one", 6, 15, List.of(0, 4), "b", false));
    }

    @Test
    void setAlarmShouldReturnStoredAlarmWithGeneratedId() {
        when(coordinator.setAlarm(any())).thenAnswer(invocation ->
                invocation.<Alarm>getArgument(0).withGeneratedId());

        ResponseEntity<ApiResponse> response = controller.setAlarm(
                new AlarmPayload(null, 7, 30, List.of(2, 0), null, null));

        ArgumentCaptor<Alarm> sent = ArgumentCaptor.forClass(Alarm.class);
        verify(coordinator).setAlarm(sent.capture());
        assertThat(sent.getValue().scheduleTag()).isEqualTo(ScheduleTag.A);
        assertThat(sent.getValue().active()).isTrue();
        assertThat(sent.getValue().days()).containsExactly(0, 2);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().status()).isEqualTo("success");
        AlarmPayload stored = (AlarmPayload) response.getBody().data().get("alarm");
        assertThat(stored.id()).isNotBlank();
        assertThat(stored.scheduleTag()).isEqualTo("a");
    }

    @Test
    void missingHourShouldBeRejectedBeforeReachingCoordinator() {
        assertThatThrownBy(() -> controller.setAlarm(new AlarmPayload("x", null, 0, List.of(0), "a", true)))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("hour");
        verify(coordinator, never()).setAlarm(any());
    }

    @Test
    void unknownScheduleTagShouldBeRejected() {
        assertThatThrownBy(() -> controller.setAlarm(new AlarmPayload("x", 7, 0, List.of(0), "c", true)))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("schedule_tag");
    }

    @Test
    void nullDayShouldBeRejected() {
        assertThatThrownBy(() -> controller.setAlarm(
                new AlarmPayload("x", 7, 0, java.util.Arrays.asList(0, null), "a", true)))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("days");
    }

    @Test
    void removeShouldReportPartialSuccess() {
        when(coordinator.removeAlarms(List.of("one", "missing"))).thenReturn(false);

        ResponseEntity<ApiResponse> response = controller.removeAlarms(List.of("one", "missing"));

        assertThat(response.getBody().message()).isEqualTo("Some alarms could not be removed");
        assertThat(response.getBody().data())
                .containsEntry("removed_all", false)
                .containsEntry("alarm_ids", List.of("one", "missing"));
    }

    @Test
    void removeShouldReportFullSuccess() {
        when(coordinator.removeAlarms(List.of("one"))).thenReturn(true);

        ResponseEntity<ApiResponse> response = controller.removeAlarms(List.of("one"));

        assertThat(response.getBody().message()).isEqualTo("Alarms removed successfully");
        assertThat(response.getBody().data()).containsEntry("removed_all", true);
    }
}
