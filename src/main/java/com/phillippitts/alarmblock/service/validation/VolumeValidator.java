package com.phillippitts.alarmblock.service.validation;

import com.phillippitts.alarmblock.exception.ValidationException;

/**
 * Range check shared by every volume setter (0-100 percent).
 */
public final class VolumeValidator {

    public static final int MIN_VOLUME = 0;
    public static final int MAX_VOLUME = 100;

    private VolumeValidator() {
    }

    /**
     * @param field name reported on failure, e.g. {@code volume} or {@code alarm_volume}
     * @param volume requested level
     * @return the volume, unchanged
     * @throws ValidationException when outside [0, 100]
     */
    public static int requireInRange(String field, int volume) {
        if (volume < MIN_VOLUME || volume > MAX_VOLUME) {
            throw new ValidationException(field, volume,
                    "must be between " + MIN_VOLUME + " and " + MAX_VOLUME);
        }
        return volume;
    }
}
