package com.company.consolidation.util;

import java.time.Duration;
import java.time.Instant;

public class TimeUtils {

    /**
     * Overlap of two time ranges relative to their average duration.
     *
     * Returns 0 when the ranges do not intersect and 1.0 for identical
     * ranges. Two instantaneous events at the same instant score 1.0.
     *
     * @param start1 Start of the first range
     * @param end1 End of the first range
     * @param start2 Start of the second range
     * @param end2 End of the second range
     * @return Overlap ratio, never negative
     */
    public static double timeOverlapRatio(Instant start1, Instant end1, Instant start2, Instant end2) {
        if (start1 == null || end1 == null || start2 == null || end2 == null) return 0.0;

        if (end1.isBefore(start2) || end2.isBefore(start1)) {
            return 0.0;
        }

        Instant overlapStart = start1.isAfter(start2) ? start1 : start2;
        Instant overlapEnd = end1.isBefore(end2) ? end1 : end2;
        long overlapMs = Duration.between(overlapStart, overlapEnd).toMillis();

        long duration1 = Duration.between(start1, end1).toMillis();
        long duration2 = Duration.between(start2, end2).toMillis();
        long totalMs = duration1 + duration2;

        if (totalMs <= 0) {
            // both instantaneous and intersecting, so the same instant
            return 1.0;
        }

        return Math.max(0.0, overlapMs / (totalMs / 2.0));
    }

    /**
     * Start of a look-back window ending at {@code now}.
     */
    public static Instant windowStart(Instant now, int windowMinutes) {
        if (now == null) return null;
        return now.minus(Duration.ofMinutes(windowMinutes));
    }

    public static String formatDuration(Long durationMs) {
        if (durationMs == null) return null;

        long minutes = durationMs / 60000;
        long seconds = (durationMs % 60000) / 1000;
        long millis = durationMs % 1000;

        if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds);
        } else if (seconds > 0) {
            return String.format("%d.%03ds", seconds, millis);
        } else {
            return String.format("%dms", millis);
        }
    }
}
