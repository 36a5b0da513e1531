package com.phillippitts.modelorchestrator.util;

/**
 * Elapsed-time helpers around {@link System#nanoTime()}.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos, never negative
     */
    public static long elapsedMillis(long startNanos) {
        return Math.max(0, nanosToMillis(System.nanoTime() - startNanos));
    }
}
