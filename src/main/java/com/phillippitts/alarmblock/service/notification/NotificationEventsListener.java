package com.phillippitts.alarmblock.service.notification;

import com.phillippitts.alarmblock.service.notification.event.AlarmListChangedEvent;
import com.phillippitts.alarmblock.service.notification.event.AlarmStatusChangedEvent;
import com.phillippitts.alarmblock.service.notification.event.AmbientStatusChangedEvent;
import com.phillippitts.alarmblock.service.notification.event.ScheduleChangedEvent;
import com.phillippitts.alarmblock.service.notification.event.VolumeChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Logs delivered state-change notifications succinctly. */
@Component
class NotificationEventsListener {
    private static final Logger LOG = LogManager.getLogger(NotificationEventsListener.class);

    @EventListener
    void onAlarmStatus(AlarmStatusChangedEvent e) {
        LOG.info("Alarm status: playing={}", e.playing());
    }

    @EventListener
    void onAmbientStatus(AmbientStatusChangedEvent e) {
        LOG.info("Ambient status: playing={}", e.playing());
    }

    @EventListener
    void onVolume(VolumeChangedEvent e) {
        LOG.debug("Volume changed: channel={}, volume={}", e.channel(), e.volume());
    }

    @EventListener
    void onAlarmList(AlarmListChangedEvent e) {
        LOG.debug("Alarm list changed: count={}", e.alarms().size());
    }

    @EventListener
    void onSchedule(ScheduleChangedEvent e) {
        LOG.info("Global schedule changed: mode={}", e.mode());
    }
}
