/**
 * Domain values shared by the scheduling and audio layers: {@link com.phillippitts.alarmblock.domain.Alarm},
 * {@link com.phillippitts.alarmblock.domain.ScheduleTag} and {@link com.phillippitts.alarmblock.domain.GlobalMode}.
 */
package com.phillippitts.alarmblock.domain;
