package com.company.decommissioning.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public class TimeUtils {

    private static final long SECONDS_PER_DAY = 86_400;

    private TimeUtils() {
    }

    /**
     * Seconds as fractional days, e.g. 259200 -> "3.0".
     */
    public static String formatDays(long seconds) {
        return BigDecimal.valueOf(seconds)
                .divide(BigDecimal.valueOf(SECONDS_PER_DAY), 1, RoundingMode.HALF_UP)
                .toPlainString();
    }

    /**
     * Seconds as whole days, rounded.
     */
    public static long wholeDays(long seconds) {
        return Math.round((double) seconds / SECONDS_PER_DAY);
    }

    public static String formatDuration(long seconds) {
        long days = seconds / SECONDS_PER_DAY;
        long hours = (seconds % SECONDS_PER_DAY) / 3600;
        long minutes = (seconds % 3600) / 60;

        if (days > 0) {
            return String.format("%dd %dh", days, hours);
        } else if (hours > 0) {
            return String.format("%dh %dm", hours, minutes);
        } else {
            return String.format("%dm %ds", minutes, seconds % 60);
        }
    }
}
