package com.phillippitts.alarmblock.service.notification;

import com.phillippitts.alarmblock.domain.Alarm;
import com.phillippitts.alarmblock.domain.GlobalMode;
import com.phillippitts.alarmblock.service.notification.event.AlarmListChangedEvent;
import com.phillippitts.alarmblock.service.notification.event.AlarmStatusChangedEvent;
import com.phillippitts.alarmblock.service.notification.event.AmbientStatusChangedEvent;
import com.phillippitts.alarmblock.service.notification.event.ScheduleChangedEvent;
import com.phillippitts.alarmblock.service.notification.event.VolumeChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * {@link NotificationSink} that turns each notification into a Spring application event and
 * publishes it from the notification executor.
 *
 * <p>The executor acts as the outbound queue: the coordinator thread only enqueues, and listeners
 * (e.g. a WebSocket broadcaster) run on the dispatcher thread. Rejected or failing deliveries are
 * logged and never reach the caller.
 */
@Component
public class EventPublishingNotificationSink implements NotificationSink {

    private static final Logger LOG = LogManager.getLogger(EventPublishingNotificationSink.class);

    private final ApplicationEventPublisher publisher;
    private final Executor executor;

    public EventPublishingNotificationSink(ApplicationEventPublisher publisher,
                                           @Qualifier("notificationExecutor") Executor executor) {
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    @Override
    public void notifyAlarmStatus(boolean playing) {
        dispatch(new AlarmStatusChangedEvent(playing, Instant.now()));
    }

    @Override
    public void notifyAmbientStatus(boolean playing) {
        dispatch(new AmbientStatusChangedEvent(playing, Instant.now()));
    }

    @Override
    public void notifyVolume(int volume) {
        dispatch(new VolumeChangedEvent(VolumeChangedEvent.Channel.AMBIENT, volume, Instant.now()));
    }

    @Override
    public void notifyAlarmVolume(int volume) {
        dispatch(new VolumeChangedEvent(VolumeChangedEvent.Channel.ALARM, volume, Instant.now()));
    }

    @Override
    public void notifyAlarmList(List<Alarm> alarms) {
        dispatch(new AlarmListChangedEvent(alarms, Instant.now()));
    }

    @Override
    public void notifyScheduleChanged(GlobalMode mode) {
        dispatch(new ScheduleChangedEvent(mode, Instant.now()));
    }

    private void dispatch(Object event) {
        try {
            executor.execute(() -> deliver(event));
        } catch (RuntimeException e) {
            LOG.warn("Notification dropped, dispatcher unavailable: event={}, error={}",
                    event.getClass().getSimpleName(), e.toString());
        }
    }

    private void deliver(Object event) {
        try {
            publisher.publishEvent(event);
        } catch (RuntimeException e) {
            LOG.warn("Notification delivery failed: event={}", event.getClass().getSimpleName(), e);
        }
    }
}
