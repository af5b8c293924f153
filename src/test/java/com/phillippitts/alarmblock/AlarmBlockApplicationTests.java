package com.phillippitts.alarmblock;

import com.phillippitts.alarmblock.service.alarm.TriggerScheduler;
import com.phillippitts.alarmblock.service.audio.AudioCoordinator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@Tag("integration")
@AutoConfigureMockMvc
@SpringBootTest(
    properties = {
        "logging.config=classpath:log4j2-test.xml",
        "audio.mode=simulated",
        "audio.simulated-alarm-sounds=alarm_one,alarm_two",
        "alarm.zone=UTC",
        "alarm.store-path=${java.io.tmpdir}/alarm-block-it/${random.uuid}/alarms.json",
        "settings.path=${java.io.tmpdir}/alarm-block-it/${random.uuid}/settings.json"
    }
)
class AlarmBlockApplicationTests {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private TriggerScheduler triggerScheduler;

    @Autowired
    private AudioCoordinator audioCoordinator;

    @AfterEach
    void tearDown() {
        audioCoordinator.stopAlarm();
        audioCoordinator.stopAmbient();
    }

    @Test
    void setThenRemoveAlarmOverHttp() throws Exception {
        mvc.perform(put("/alarm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": \"it-wake\", \"hour\": 6, \"minute\": 45, \"days\": [0, 1, 2, 3, 4],"
                                + " \"schedule_tag\": \"b\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.data.alarm.schedule_tag").value("b"))
                .andExpect(jsonPath("$.data.alarm.active").value(true));
        assertThat(triggerScheduler.isScheduled("it-wake")).isTrue();

        mvc.perform(get("/alarms"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.id == 'it-wake')].hour").value(6));

        mvc.perform(delete("/alarms")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[\"it-wake\", \"never-existed\"]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.removed_all").value(false));
        assertThat(triggerScheduler.isScheduled("it-wake")).isFalse();
    }

    @Test
    void invalidAlarmIsRejectedWith400() throws Exception {
        mvc.perform(put("/alarm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"hour\": 25, \"minute\": 0, \"days\": [0]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid hour"));
    }

    @Test
    void malformedBodyIsRejectedWith400() throws Exception {
        mvc.perform(put("/alarm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("MalformedRequest"));
    }

    @Test
    void fractionalTimeFieldIsRejectedNotTruncated() throws Exception {
        mvc.perform(put("/alarm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": \"it-frac\", \"hour\": 7.9, \"minute\": 0, \"days\": [0]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("MalformedRequest"));

        assertThat(triggerScheduler.isScheduled("it-frac")).isFalse();
    }

    @Test
    void originalWhiteNoiseAndVolumeRoutesAreServed() throws Exception {
        mvc.perform(post("/white-noise")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\": \"play\"}"))
                .andExpect(status().isOk());
        mvc.perform(get("/white-noise/status"))
                .andExpect(jsonPath("$.data.playing").value(true));

        mvc.perform(post("/white-noise")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\": \"pause\"}"))
                .andExpect(status().isBadRequest());

        mvc.perform(post("/volume")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"volume\": 35}"))
                .andExpect(status().isOk());
        mvc.perform(get("/volume"))
                .andExpect(jsonPath("$.volume").value(35));
        mvc.perform(get("/alarm/status"))
                .andExpect(jsonPath("$.is_playing").value(false));
    }

    @Test
    void playAndStopAlarmDriveAudioStatus() throws Exception {
        mvc.perform(post("/play-alarm")).andExpect(status().isOk());
        mvc.perform(get("/audio/status"))
                .andExpect(jsonPath("$.alarmPlaying").value(true));

        mvc.perform(post("/stop-alarm")).andExpect(status().isOk());
        mvc.perform(post("/stop-alarm")).andExpect(status().isOk());
        mvc.perform(get("/audio/status"))
                .andExpect(jsonPath("$.alarmPlaying").value(false));
    }

    @Test
    void volumeOutOfRangeIsRejected() throws Exception {
        mvc.perform(put("/volume")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"volume\": 150}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid volume"));

        mvc.perform(put("/alarm-volume")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"volume\": 60}"))
                .andExpect(status().isOk());
        mvc.perform(get("/volume"))
                .andExpect(jsonPath("$.alarm_volume").value(60));
    }

    @Test
    void scheduleRoundTripsOverHttp() throws Exception {
        mvc.perform(put("/schedule")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"schedule\": \"off\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.schedule").value("off"));

        mvc.perform(get("/schedule"))
                .andExpect(jsonPath("$.schedule").value("off"));
    }

    @Test
    void requestIdIsEchoed() throws Exception {
        mvc.perform(get("/alarms").header("X-Request-ID", "it-123"))
                .andExpect(header().string("X-Request-ID", "it-123"));
    }

    @Test
    void healthReportsAudioOutput() throws Exception {
        mvc.perform(get("/actuator/health"))
                .andExpect(jsonPath("$.components.audioOutput.details.mode").value("simulated"))
                .andExpect(jsonPath("$.components.audioOutput.details.alarmSounds").value(2));
    }
}
