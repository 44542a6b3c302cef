package com.phillippitts.aura.util;

/**
 * Utility methods for elapsed time calculations with {@link System#nanoTime()}.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Milliseconds left until {@code deadlineNanos}, never negative.
     */
    public static long remainingMillis(long deadlineNanos) {
        return Math.max(0L, (deadlineNanos - System.nanoTime()) / NANOS_PER_MILLI);
    }
}
