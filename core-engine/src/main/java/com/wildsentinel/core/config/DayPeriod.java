package com.wildsentinel.core.config;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Coarse periods of the day used by species activity patterns.
 *
 * @since 1.0.0
 */
public enum DayPeriod {

    DAWN,
    DAY,
    DUSK,
    NIGHT;

    /**
     * Map a local hour to a period: dawn 05-07, day 08-16, dusk 17-19,
     * night otherwise.
     */
    public static DayPeriod ofHour(int hour) {
        if (hour >= 5 && hour <= 7) {
            return DAWN;
        }
        if (hour >= 8 && hour <= 16) {
            return DAY;
        }
        if (hour >= 17 && hour <= 19) {
            return DUSK;
        }
        return NIGHT;
    }

    /**
     * @param value case-insensitive period name
     * @return the period, or empty if unrecognised
     */
    public static Optional<DayPeriod> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    static boolean isKnown(String value) {
        return parse(value).isPresent();
    }

    static List<String> names() {
        return Arrays.stream(values()).map(p -> p.name().toLowerCase(Locale.ROOT)).toList();
    }

    /**
     * @return the lowercase name used in configuration
     */
    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
