package com.phillippitts.alarmblock.service.settings;

import com.phillippitts.alarmblock.domain.GlobalMode;

/**
 * Global settings the core reads and writes without knowing their storage format.
 */
public interface SettingsProvider {

    /**
     * @return the currently selected schedule ({@code a}, {@code b} or {@code off})
     */
    GlobalMode getGlobalSchedule();

    /**
     * Selects the active schedule and persists it.
     */
    void setGlobalSchedule(GlobalMode mode);

    /**
     * @return persisted ambient volume, 0-100
     */
    int getVolume();

    /**
     * Persists the ambient volume.
     *
     * @throws com.phillippitts.alarmblock.exception.ValidationException if outside 0-100
     */
    void setVolume(int volume);

    /**
     * @return persisted alarm volume, 0-100
     */
    int getAlarmVolume();

    /**
     * Persists the alarm volume.
     *
     * @throws com.phillippitts.alarmblock.exception.ValidationException if outside 0-100
     */
    void setAlarmVolume(int volume);
}
