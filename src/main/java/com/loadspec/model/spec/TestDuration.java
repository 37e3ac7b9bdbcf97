package com.loadspec.model.spec;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A positive amount of time expressed in seconds, minutes or hours.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TestDuration {

    private int value;

    private DurationUnit unit;

    public static TestDuration seconds(int value) {
        return new TestDuration(value, DurationUnit.SECONDS);
    }

    public static TestDuration minutes(int value) {
        return new TestDuration(value, DurationUnit.MINUTES);
    }

    @JsonIgnore
    public boolean isPositive() {
        return value > 0 && unit != null;
    }

    @JsonIgnore
    public long toSeconds() {
        return unit == null ? value : unit.toSeconds(value);
    }

    /**
     * Renders the duration for humans, e.g. "10 seconds" or "1 minute".
     *
     * @return The readable form.
     */
    public String describe() {
        String unitName = unit == null ? "seconds" : unit.value();
        if (value == 1) {
            unitName = unitName.substring(0, unitName.length() - 1);
        }
        return value + " " + unitName;
    }
}
