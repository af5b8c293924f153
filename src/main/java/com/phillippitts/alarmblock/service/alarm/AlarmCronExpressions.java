package com.phillippitts.alarmblock.service.alarm;

import com.phillippitts.alarmblock.domain.Alarm;

import java.util.stream.Collectors;

/**
 * Builds Spring cron expressions ({@code second minute hour day-of-month month day-of-week})
 * from alarm fields.
 */
final class AlarmCronExpressions {

    // Index 0 is Monday, matching the alarm weekday numbering
    private static final String[] CRON_DAYS = {"MON", "TUE", "WED", "THU", "FRI", "SAT", "SUN"};

    private AlarmCronExpressions() {}

    /**
     * @return e.g. {@code 0 30 7 * * MON,WED,FRI} for 07:30 on days {0, 2, 4}
     * @throws IllegalArgumentException if a day is outside 0-6 or no day is set
     */
    static String toCron(Alarm alarm) {
        if (alarm.days().isEmpty()) {
            throw new IllegalArgumentException("alarm has no days");
        }
        String days = alarm.days().stream()
                .map(AlarmCronExpressions::dayName)
                .collect(Collectors.joining(","));
        return "0 " + alarm.minute() + " " + alarm.hour() + " * * " + days;
    }

    private static String dayName(int day) {
        if (day < 0 || day >= CRON_DAYS.length) {
            throw new IllegalArgumentException("day " + day + " is out of range (0-6)");
        }
        return CRON_DAYS[day];
    }
}
