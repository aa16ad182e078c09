package io.fitwatch.convert;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Ordered, duplicate-free list of CSV column names. Immutable.
 *
 * <p>{@link #fromKeys} places the {@linkplain #PREFERRED preferred columns} that are present
 * first, in their fixed order, followed by every other key in lexicographic order. The
 * ordering depends only on the key set, so converting the same input twice yields the same
 * header.
 */
public final class CsvHeader {

    public static final String TIMESTAMP = "timestamp";
    public static final String POSITION_LAT = "position_lat";
    public static final String POSITION_LONG = "position_long";
    public static final String SPEED = "speed";
    public static final String ENHANCED_SPEED = "enhanced_speed";
    public static final String CADENCE = "cadence";

    public static final String CADENCE_SPM = "cadence_spm";
    public static final String PACE = "pace_mm_ss_per_mile";
    public static final String LATITUDE_DEG = "latitude_deg";
    public static final String LONGITUDE_DEG = "longitude_deg";

    public static final List<String> PREFERRED = List.of(
            TIMESTAMP, POSITION_LAT, POSITION_LONG, "distance", SPEED, "heart_rate", CADENCE, "temperature");

    private final List<String> columns;

    private CsvHeader(List<String> columns) {
        this.columns = Collections.unmodifiableList(columns);
    }

    /**
     * Builds the header for the union of keys seen across a file's records.
     *
     * @param keys every key that occurs in at least one record
     * @return the ordered header
     * @throws IllegalArgumentException if {@code keys} is empty
     */
    public static CsvHeader fromKeys(Collection<String> keys) {
        Objects.requireNonNull(keys, "keys");
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("keys must not be empty");
        }
        Set<String> remaining = new TreeSet<>(keys);
        List<String> ordered = new ArrayList<>(remaining.size());
        for (String name : PREFERRED) {
            if (remaining.remove(name)) {
                ordered.add(name);
            }
        }
        ordered.addAll(remaining);
        return new CsvHeader(ordered);
    }

    /**
     * Returns the header with readability renames applied, keeping column positions.
     *
     * <p>{@code speed} and {@code enhanced_speed} collapse into a single
     * {@value #PACE} column at the position of whichever comes first.
     */
    public CsvHeader transformed() {
        Set<String> renamed = new LinkedHashSet<>();
        for (String name : columns) {
            switch (name) {
                case CADENCE -> renamed.add(CADENCE_SPM);
                case SPEED, ENHANCED_SPEED -> renamed.add(PACE);
                case POSITION_LAT -> renamed.add(LATITUDE_DEG);
                case POSITION_LONG -> renamed.add(LONGITUDE_DEG);
                default -> renamed.add(name);
            }
        }
        return new CsvHeader(new ArrayList<>(renamed));
    }

    public List<String> columns() {
        return columns;
    }

    public boolean contains(String column) {
        return columns.contains(column);
    }

    public int size() {
        return columns.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CsvHeader other && columns.equals(other.columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return columns.toString();
    }
}
