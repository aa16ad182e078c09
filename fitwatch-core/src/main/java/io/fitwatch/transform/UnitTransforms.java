package io.fitwatch.transform;

import java.util.Locale;

/**
 * Converts raw device units into readable ones.
 *
 * <p>Every function is null-tolerant: a missing or non-numeric input yields {@code null}
 * rather than an exception, so one bad sample never fails a whole file.
 */
public final class UnitTransforms {

    /** Metres in one statute mile. */
    public static final double METERS_PER_MILE = 1609.344;

    private static final double DEGREES_PER_SEMICIRCLE = 180.0 / (1L << 31);

    private UnitTransforms() {
    }

    /**
     * Converts per-leg cadence (rpm) to steps per minute by doubling it.
     *
     * @param rawCadence cadence as reported by the device
     * @return steps per minute, or {@code null}
     */
    public static Double cadenceToSpm(Object rawCadence) {
        Double cadence = toDouble(rawCadence);
        return cadence == null ? null : cadence * 2.0;
    }

    /**
     * Converts a speed in metres per second to a {@code MM:SS} pace per mile.
     *
     * @param metersPerSecond speed
     * @return zero-padded pace, or {@code null} when the speed is missing or not positive
     */
    public static String paceFromSpeed(Object metersPerSecond) {
        Double speed = toDouble(metersPerSecond);
        if (speed == null || speed <= 0) {
            return null;
        }
        double secondsPerMile = METERS_PER_MILE / speed;
        int minutes = (int) Math.floor(secondsPerMile / 60);
        // rint rounds half to even
        int seconds = (int) Math.rint(secondsPerMile - minutes * 60.0);
        if (seconds == 60) {
            minutes++;
            seconds = 0;
        }
        return String.format(Locale.ROOT, "%02d:%02d", minutes, seconds);
    }

    /**
     * Converts a FIT semicircle coordinate to decimal degrees.
     *
     * @param semicircles latitude or longitude in semicircles
     * @return degrees, or {@code null}
     */
    public static Double semicirclesToDegrees(Object semicircles) {
        Double value = toDouble(semicircles);
        return value == null ? null : value * DEGREES_PER_SEMICIRCLE;
    }

    static Double toDouble(Object value) {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        if (value instanceof CharSequence text) {
            try {
                double d = Double.parseDouble(text.toString().trim());
                return Double.isFinite(d) ? d : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
