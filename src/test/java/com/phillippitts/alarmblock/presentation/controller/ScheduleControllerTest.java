package com.phillippitts.alarmblock.presentation.controller;

import com.phillippitts.alarmblock.domain.GlobalMode;
import com.phillippitts.alarmblock.exception.ValidationException;
import com.phillippitts.alarmblock.testutil.InMemorySettingsProvider;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleControllerTest {

    private final InMemorySettingsProvider settings = new InMemorySettingsProvider(GlobalMode.A, 25, 75);
    private final ScheduleController controller = new ScheduleController(settings);

    @Test
    void shouldReturnCurrentSchedule() {
        assertThat(controller.getSchedule()).containsEntry("schedule", "a");
    }

    @Test
    void shouldUpdateScheduleCaseInsensitively() {
        assertThat(controller.setSchedule(new ScheduleController.ScheduleRequest("OFF")))
                .containsEntry("schedule", "off");
        assertThat(settings.getGlobalSchedule()).isEqualTo(GlobalMode.OFF);
    }

    @Test
    void unknownScheduleShouldBeRejected() {
        assertThatThrownBy(() -> controller.setSchedule(new ScheduleController.ScheduleRequest("weekends")))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("schedule");
        assertThat(settings.getGlobalSchedule()).isEqualTo(GlobalMode.A);
    }

    @Test
    void missingBodyShouldBeRejected() {
        assertThatThrownBy(() -> controller.setSchedule(null)).isInstanceOf(ValidationException.class);
    }
}
