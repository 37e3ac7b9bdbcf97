package com.loadspec.model.spec;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Set;

public enum DurationUnit {
    SECONDS("seconds", 1),
    MINUTES("minutes", 60),
    HOURS("hours", 3600);

    private static final Set<String> SECOND_NAMES = Set.of("s", "sec", "secs", "second", "seconds");
    private static final Set<String> MINUTE_NAMES = Set.of("m", "min", "mins", "minute", "minutes");
    private static final Set<String> HOUR_NAMES = Set.of("h", "hr", "hrs", "hour", "hours");

    private final String value;
    private final long seconds;

    DurationUnit(String value, long seconds) {
        this.value = value;
        this.seconds = seconds;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public long toSeconds(long amount) {
        return amount * seconds;
    }

    /**
     * Resolves full names, singular forms and common abbreviations ("s", "min", "hrs").
     * Anything else, milliseconds included, is not a supported unit.
     *
     * @param raw The unit text.
     * @return The matching unit or {@code null}.
     */
    @JsonCreator
    public static DurationUnit fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if (SECOND_NAMES.contains(normalized)) {
            return SECONDS;
        }
        if (MINUTE_NAMES.contains(normalized)) {
            return MINUTES;
        }
        if (HOUR_NAMES.contains(normalized)) {
            return HOURS;
        }
        return null;
    }
}
