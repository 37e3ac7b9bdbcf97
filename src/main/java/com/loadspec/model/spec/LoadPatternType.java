package com.loadspec.model.spec;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * The shape of virtual-user or request-rate growth over the test duration.
 */
public enum LoadPatternType {
    CONSTANT("constant"),
    RAMP_UP("ramp-up"),
    SPIKE("spike"),
    STEP("step");

    private final String value;

    LoadPatternType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Lenient lookup accepting "ramp-up", "ramp_up", "rampup" and "ramp".
     *
     * @param raw The wire value.
     * @return The matching pattern type or {@code null}.
     */
    @JsonCreator
    public static LoadPatternType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        if (normalized.equals("rampup") || normalized.equals("ramp")) {
            return RAMP_UP;
        }
        for (LoadPatternType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
