package io.fitwatch.fit;

import java.time.Instant;
import java.util.Map;

/**
 * The subset of the FIT global profile needed to name and scale activity data.
 *
 * <p>Only {@code record} fields are named individually; other fields decode as
 * {@code unknown_<number>} with their raw value. Field 253 is the timestamp in every message.
 */
final class FitProfile {

    static final int TIMESTAMP_FIELD = 253;

    /** Seconds between the Unix epoch and the FIT epoch (1989-12-31T00:00:00Z). */
    static final long FIT_EPOCH_OFFSET = 631_065_600L;

    /** date_time values below this are relative (seconds since device power-up), not absolute. */
    private static final long MIN_ABSOLUTE_DATE_TIME = 0x10000000L;

    static final int MESG_RECORD = 20;

    private static final Map<String, Integer> MESSAGE_NUMBERS = Map.of(
            "file_id", 0,
            "sport", 12,
            "session", 18,
            "lap", 19,
            "record", MESG_RECORD,
            "event", 21,
            "device_info", 23,
            "activity", 34,
            "file_creator", 49);

    private static final Map<Integer, Field> RECORD_FIELDS = Map.ofEntries(
            Map.entry(0, new Field("position_lat")),
            Map.entry(1, new Field("position_long")),
            Map.entry(2, new Field("altitude", 5, 500)),
            Map.entry(3, new Field("heart_rate")),
            Map.entry(4, new Field("cadence")),
            Map.entry(5, new Field("distance", 100, 0)),
            Map.entry(6, new Field("speed", 1000, 0)),
            Map.entry(7, new Field("power")),
            Map.entry(8, new Field("compressed_speed_distance")),
            Map.entry(9, new Field("grade", 100, 0)),
            Map.entry(10, new Field("resistance")),
            Map.entry(11, new Field("time_from_course", 1000, 0)),
            Map.entry(12, new Field("cycle_length", 100, 0)),
            Map.entry(13, new Field("temperature")),
            Map.entry(18, new Field("cycles")),
            Map.entry(19, new Field("total_cycles")),
            Map.entry(29, new Field("accumulated_power")),
            Map.entry(30, new Field("left_right_balance")),
            Map.entry(31, new Field("gps_accuracy")),
            Map.entry(32, new Field("vertical_speed", 1000, 0)),
            Map.entry(33, new Field("calories")),
            Map.entry(39, new Field("vertical_oscillation", 10, 0)),
            Map.entry(40, new Field("stance_time_percent", 100, 0)),
            Map.entry(41, new Field("stance_time", 10, 0)),
            Map.entry(42, new Field("activity_type")),
            Map.entry(53, new Field("fractional_cadence", 128, 0)),
            Map.entry(73, new Field("enhanced_speed", 1000, 0)),
            Map.entry(78, new Field("enhanced_altitude", 5, 500)),
            Map.entry(81, new Field("battery_soc", 2, 0)),
            Map.entry(83, new Field("vertical_ratio", 100, 0)),
            Map.entry(84, new Field("stance_time_balance", 100, 0)),
            Map.entry(85, new Field("step_length", 10, 0)));

    private FitProfile() {
    }

    /**
     * @return the global message number for a message kind name, or {@code null} if unknown
     */
    static Integer messageNumber(String kind) {
        return MESSAGE_NUMBERS.get(kind);
    }

    static String fieldName(int globalMessage, int fieldNumber) {
        if (fieldNumber == TIMESTAMP_FIELD) {
            return "timestamp";
        }
        if (globalMessage == MESG_RECORD) {
            Field field = RECORD_FIELDS.get(fieldNumber);
            if (field != null) {
                return field.name();
            }
        }
        return "unknown_" + fieldNumber;
    }

    /**
     * Applies the profile's scale and offset (and date conversion) to one decoded value.
     */
    static Object apply(int globalMessage, int fieldNumber, Object value) {
        if (fieldNumber == TIMESTAMP_FIELD && value instanceof Long seconds) {
            return toDateTime(seconds);
        }
        if (globalMessage != MESG_RECORD || !(value instanceof Number number)) {
            return value;
        }
        Field field = RECORD_FIELDS.get(fieldNumber);
        if (field == null || (field.scale() == 1 && field.offset() == 0)) {
            return value;
        }
        return number.doubleValue() / field.scale() - field.offset();
    }

    static Object toDateTime(long seconds) {
        if (seconds < MIN_ABSOLUTE_DATE_TIME) {
            return seconds;
        }
        return Instant.ofEpochSecond(FIT_EPOCH_OFFSET + seconds);
    }

    private record Field(String name, int scale, int offset) {
        Field(String name) {
            this(name, 1, 0);
        }
    }
}
