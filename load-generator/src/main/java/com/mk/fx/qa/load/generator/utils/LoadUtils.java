package com.mk.fx.qa.load.generator.utils;

import java.math.BigDecimal;
import java.time.Duration;

public final class LoadUtils {

    private LoadUtils() {
        // Utility class, no instantiation
    }

    public static Duration toDuration(Duration duration) {
        return duration != null ? duration : Duration.ZERO;
    }

    /**
     * Parses {@code 500ms}, {@code 3s}, {@code 2m}, {@code 1h}, or a bare decimal number of seconds
     * such as {@code 0.5}.
     *
     * @throws IllegalArgumentException if the value cannot be parsed
     */
    public static Duration parseDuration(String value) {
        if (value == null || value.isBlank()) {
            return Duration.ZERO;
        }
        String trimmed = value.trim().toLowerCase();
        try {
            if (trimmed.endsWith("ms")) {
                long ms = Long.parseLong(trimmed.substring(0, trimmed.length() - 2).trim());
                return Duration.ofMillis(ms);
            }
            char unit = trimmed.charAt(trimmed.length() - 1);
            if (Character.isDigit(unit) || unit == '.') {
                return fromSeconds(new BigDecimal(trimmed));
            }
            long amount = Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim());
            return switch (unit) {
                case 's' -> Duration.ofSeconds(amount);
                case 'm' -> Duration.ofMinutes(amount);
                case 'h' -> Duration.ofHours(amount);
                default -> throw new IllegalArgumentException("Unrecognised duration unit in " + value);
            };
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("Invalid duration '" + value + "'", e);
        }
    }

    /** Converts decimal seconds to a duration with nanosecond precision. */
    public static Duration fromSeconds(BigDecimal seconds) {
        var nanos = seconds.movePointRight(9).setScale(0, java.math.RoundingMode.HALF_UP);
        return Duration.ofNanos(nanos.longValueExact());
    }

    /** Duration as decimal seconds. */
    public static double toSeconds(Duration duration) {
        return toDuration(duration).toNanos() / 1_000_000_000.0;
    }
}
