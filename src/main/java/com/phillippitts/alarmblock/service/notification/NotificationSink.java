package com.phillippitts.alarmblock.service.notification;

import com.phillippitts.alarmblock.domain.Alarm;
import com.phillippitts.alarmblock.domain.GlobalMode;

import java.util.List;

/**
 * Outbound push interface the coordinators call after a state change has been committed.
 *
 * <p>Implementations must be fire-and-forget: they must not block the caller and must not throw.
 * Delivery failures are the implementation's concern.
 */
public interface NotificationSink {

    void notifyAlarmStatus(boolean playing);

    void notifyAmbientStatus(boolean playing);

    void notifyVolume(int volume);

    void notifyAlarmVolume(int volume);

    void notifyAlarmList(List<Alarm> alarms);

    void notifyScheduleChanged(GlobalMode mode);
}
