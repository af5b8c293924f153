package com.phillippitts.alarmblock.service.alarm;

import com.phillippitts.alarmblock.domain.Alarm;
import com.phillippitts.alarmblock.domain.GlobalMode;

import java.util.Optional;

/**
 * Decides whether a fired alarm sounds. Checks run in a fixed order and the first failing check
 * names the decision:
 * <ol>
 *   <li>alarm no longer exists</li>
 *   <li>global schedule is off</li>
 *   <li>alarm tag differs from the global schedule</li>
 *   <li>alarm is inactive</li>
 * </ol>
 * Stateless.
 */
public class TriggerGate {

    public GateDecision evaluate(Optional<Alarm> alarm, GlobalMode globalMode) {
        if (alarm.isEmpty()) {
            return GateDecision.BLOCKED_MISSING;
        }
        if (globalMode == null || globalMode == GlobalMode.OFF) {
            return GateDecision.BLOCKED_OFF;
        }
        Alarm candidate = alarm.get();
        if (!globalMode.selects(candidate.scheduleTag())) {
            return GateDecision.BLOCKED_SCHEDULE_MISMATCH;
        }
        if (!candidate.active()) {
            return GateDecision.BLOCKED_INACTIVE;
        }
        return GateDecision.PLAY;
    }
}
