package com.phillippitts.alarmblock.presentation.controller;

import com.phillippitts.alarmblock.domain.Alarm;
import com.phillippitts.alarmblock.exception.ValidationException;
import com.phillippitts.alarmblock.service.alarm.AlarmCoordinator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Alarm CRUD. Thin adapter over {@link AlarmCoordinator}.
 */
@RestController
class AlarmController {

    private static final Logger LOG = LogManager.getLogger(AlarmController.class);

    private final AlarmCoordinator alarmCoordinator;

    AlarmController(AlarmCoordinator alarmCoordinator) {
        this.alarmCoordinator = alarmCoordinator;
    }

    @GetMapping("/alarms")
    List<AlarmPayload> getAlarms() {
        List<AlarmPayload> alarms = alarmCoordinator.getAlarms().stream()
                .map(AlarmPayload::from)
                .toList();
        LOG.debug("Retrieved {} alarms", alarms.size());
        return alarms;
    }

    @PutMapping("/alarm")
    ResponseEntity<ApiResponse> setAlarm(@RequestBody AlarmPayload payload) {
        if (payload == null) {
            throw new ValidationException("alarm", null, "request body is required");
        }
        Alarm stored = alarmCoordinator.setAlarm(payload.toAlarm());
        return ResponseEntity.ok(ApiResponse.success("Alarm set successfully",
                Map.of("alarm", AlarmPayload.from(stored))));
    }

    @DeleteMapping("/alarms")
    ResponseEntity<ApiResponse> removeAlarms(@RequestBody List<String> alarmIds) {
        boolean removedAll = alarmCoordinator.removeAlarms(alarmIds);
        String message = removedAll ? "Alarms removed successfully" : "Some alarms could not be removed";
        return ResponseEntity.ok(ApiResponse.success(message,
                Map.of("removed_all", removedAll, "alarm_ids", alarmIds)));
    }
}
