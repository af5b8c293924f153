package com.phillippitts.alarmblock.presentation.controller;

import com.phillippitts.alarmblock.exception.ValidationException;
import com.phillippitts.alarmblock.service.audio.AudioCoordinator;
import com.phillippitts.alarmblock.service.audio.AudioStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Playback and volume controls. A start that finds no free channel answers 503 so the client
 * can retry.
 */
@RestController
class AudioController {

    private final AudioCoordinator audio;

    AudioController(AudioCoordinator audio) {
        this.audio = audio;
    }

    record VolumeRequest(Integer volume) {
    }

    record WhiteNoiseRequest(String action) {
    }

    @PostMapping("/play-alarm")
    ResponseEntity<ApiResponse> playAlarm() {
        if (!audio.playAlarm()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ApiResponse.error("Alarm could not be started", Map.of("playing", false)));
        }
        return ResponseEntity.ok(ApiResponse.success("Alarm playing", Map.of("playing", true)));
    }

    @PostMapping("/stop-alarm")
    ResponseEntity<ApiResponse> stopAlarm() {
        audio.stopAlarm();
        return ResponseEntity.ok(ApiResponse.success("Alarm stopped", Map.of("playing", false)));
    }

    @PostMapping("/ambient/play")
    ResponseEntity<ApiResponse> playAmbient() {
        if (!audio.playAmbient()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ApiResponse.error("Ambient sound could not be started", Map.of("playing", false)));
        }
        return ResponseEntity.ok(ApiResponse.success("Ambient sound playing", Map.of("playing", true)));
    }

    @PostMapping("/ambient/stop")
    ResponseEntity<ApiResponse> stopAmbient() {
        audio.stopAmbient();
        return ResponseEntity.ok(ApiResponse.success("Ambient sound stopped", Map.of("playing", false)));
    }

    @PostMapping("/ambient/toggle")
    ResponseEntity<ApiResponse> toggleAmbient() {
        boolean playing = audio.toggleAmbient();
        return ResponseEntity.ok(ApiResponse.success(
                playing ? "Ambient sound playing" : "Ambient sound stopped", Map.of("playing", playing)));
    }

    /**
     * Original white noise control: {@code {"action": "play" | "stop"}}.
     */
    @PostMapping("/white-noise")
    ResponseEntity<ApiResponse> whiteNoise(@RequestBody WhiteNoiseRequest request) {
        String action = request == null ? null : request.action();
        if ("play".equals(action)) {
            return playAmbient();
        }
        if ("stop".equals(action)) {
            return stopAmbient();
        }
        throw new ValidationException("action", action, "must be play or stop");
    }

    @GetMapping("/white-noise/status")
    ApiResponse whiteNoiseStatus() {
        boolean playing = audio.isAmbientPlaying();
        return ApiResponse.success(playing ? "White noise is playing" : "White noise is stopped",
                Map.of("playing", playing));
    }

    @GetMapping("/alarm/status")
    Map<String, Object> alarmStatus() {
        return Map.of("is_playing", audio.isAlarmPlaying());
    }

    @GetMapping("/audio/status")
    AudioStatus status() {
        return audio.getStatus();
    }

    @GetMapping("/volume")
    Map<String, Object> getVolume() {
        AudioStatus status = audio.getStatus();
        return Map.of("volume", status.volume(), "alarm_volume", status.alarmVolume());
    }

    @RequestMapping(path = "/volume", method = {RequestMethod.PUT, RequestMethod.POST})
    ResponseEntity<ApiResponse> setVolume(@RequestBody VolumeRequest request) {
        int volume = requireVolume(request);
        audio.setAmbientVolume(volume);
        return ResponseEntity.ok(ApiResponse.success("Volume set to " + volume, Map.of("volume", volume)));
    }

    @PutMapping("/alarm-volume")
    ResponseEntity<ApiResponse> setAlarmVolume(@RequestBody VolumeRequest request) {
        int volume = requireVolume(request);
        audio.setAlarmVolume(volume);
        return ResponseEntity.ok(ApiResponse.success("Alarm volume set to " + volume, Map.of("volume", volume)));
    }

    private static int requireVolume(VolumeRequest request) {
        if (request == null || request.volume() == null) {
            throw new ValidationException("volume", null, "is required");
        }
        return request.volume();
    }
}
