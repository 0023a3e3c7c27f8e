package com.company.trainingruns.util;

import java.time.Duration;
import java.time.Instant;

public class TimeUtils {

    private TimeUtils() {
    }

    public static String formatDuration(Integer durationSeconds) {
        if (durationSeconds == null) return null;

        long hours = durationSeconds / 3600;
        long minutes = (durationSeconds % 3600) / 60;
        long seconds = durationSeconds % 60;

        if (hours > 0) {
            return String.format("%dh %dm", hours, minutes);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds);
        } else {
            return String.format("%ds", seconds);
        }
    }

    /**
     * True when strictly more than {@code threshold} has passed between {@code since} and {@code now}.
     */
    public static boolean isOlderThan(Instant since, Duration threshold, Instant now) {
        if (since == null) return false;
        return Duration.between(since, now).compareTo(threshold) > 0;
    }
}
