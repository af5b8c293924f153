package com.phillippitts.alarmblock.presentation.controller;

import com.phillippitts.alarmblock.domain.GlobalMode;
import com.phillippitts.alarmblock.exception.ValidationException;
import com.phillippitts.alarmblock.service.settings.SettingsProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
class ScheduleController {

    private final SettingsProvider settings;

    ScheduleController(SettingsProvider settings) {
        this.settings = settings;
    }

    record ScheduleRequest(String schedule) {
    }

    @GetMapping("/schedule")
    Map<String, String> getSchedule() {
        return Map.of("schedule", settings.getGlobalSchedule().value());
    }

    @PutMapping("/schedule")
    Map<String, String> setSchedule(@RequestBody ScheduleRequest request) {
        String requested = request == null ? null : request.schedule();
        GlobalMode mode = GlobalMode.fromValue(requested)
                .orElseThrow(() -> new ValidationException("schedule", requested, "must be one of a, b, off"));
        settings.setGlobalSchedule(mode);
        return Map.of("message", "Schedule updated successfully", "schedule", mode.value());
    }
}
