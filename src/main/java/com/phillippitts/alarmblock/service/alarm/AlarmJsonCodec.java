package com.phillippitts.alarmblock.service.alarm;

import com.phillippitts.alarmblock.domain.Alarm;
import com.phillippitts.alarmblock.domain.ScheduleTag;
import com.phillippitts.alarmblock.exception.ValidationException;
import com.phillippitts.alarmblock.service.validation.AlarmValidator;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Converts alarms to and from the persisted snapshot format.
 *
 * <p>Snapshot: a JSON array of records
 * {@code {"id", "hour", "minute", "days": [int], "schedule_tag", "active"}}.
 * On read, {@code schedule_tag} falls back to the legacy {@code schedule} key and then to
 * {@code a}; a missing {@code active} means active; a missing id is generated.
 */
final class AlarmJsonCodec {

    static final String KEY_ID = "id";
    static final String KEY_HOUR = "hour";
    static final String KEY_MINUTE = "minute";
    static final String KEY_DAYS = "days";
    static final String KEY_SCHEDULE_TAG = "schedule_tag";
    static final String KEY_LEGACY_SCHEDULE = "schedule";
    static final String KEY_ACTIVE = "active";

    private AlarmJsonCodec() {}

    /**
     * Result of decoding a snapshot: the valid alarms plus a description of each rejected record.
     */
    record Decoded(List<Alarm> alarms, List<String> rejected) { }

    static String encode(Collection<Alarm> alarms) {
        JSONArray array = new JSONArray();
        for (Alarm alarm : alarms) {
            array.put(toJson(alarm));
        }
        return array.toString(2);
    }

    static JSONObject toJson(Alarm alarm) {
        JSONObject obj = new JSONObject();
        obj.put(KEY_ID, alarm.id());
        obj.put(KEY_HOUR, alarm.hour());
        obj.put(KEY_MINUTE, alarm.minute());
        obj.put(KEY_DAYS, new JSONArray(alarm.days()));
        obj.put(KEY_SCHEDULE_TAG, alarm.scheduleTag().value());
        obj.put(KEY_ACTIVE, alarm.active());
        return obj;
    }

    /**
     * Decodes a snapshot, skipping records that are malformed or violate alarm invariants.
     *
     * @param json snapshot text
     * @param validator invariant checks applied to each record
     * @return decoded alarms in file order and rejected-record descriptions
     * @throws JSONException if the text is not a JSON array at all
     */
    static Decoded decode(String json, AlarmValidator validator) {
        JSONArray array = new JSONArray(json);
        List<Alarm> alarms = new ArrayList<>(array.length());
        List<String> rejected = new ArrayList<>();
        for (int i = 0; i < array.length(); i++) {
            try {
                JSONObject obj = array.getJSONObject(i);
                Alarm alarm = fromJson(obj);
                validator.validate(alarm);
                alarms.add(alarm);
            } catch (JSONException | ValidationException e) {
                rejected.add("record " + i + ": " + e.getMessage());
            }
        }
        return new Decoded(alarms, rejected);
    }

    static Alarm fromJson(JSONObject obj) {
        String id = obj.optString(KEY_ID, "");
        if (id.isBlank()) {
            id = UUID.randomUUID().toString();
        }
        int hour = obj.getInt(KEY_HOUR);
        int minute = obj.getInt(KEY_MINUTE);

        JSONArray daysJson = obj.getJSONArray(KEY_DAYS);
        TreeSet<Integer> days = new TreeSet<>();
        for (int d = 0; d < daysJson.length(); d++) {
            days.add(daysJson.getInt(d));
        }

        String tagValue = obj.has(KEY_SCHEDULE_TAG)
                ? obj.getString(KEY_SCHEDULE_TAG)
                : obj.optString(KEY_LEGACY_SCHEDULE, ScheduleTag.A.value());
        ScheduleTag tag = ScheduleTag.fromValue(tagValue)
                .orElseThrow(() -> new ValidationException(KEY_SCHEDULE_TAG, tagValue, "must be one of a, b"));

        boolean active = obj.optBoolean(KEY_ACTIVE, true);
        return new Alarm(id, hour, minute, days, tag, active);
    }
}
