package com.loadspec.model.spec;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * How load is applied over time. A valid pattern names a {@link LoadPatternType} and
 * at least one volume field: {@code virtualUsers} or {@code requestsPerSecond}.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class LoadPattern {

    private LoadPatternType type;

    private Integer virtualUsers;

    private Integer requestsPerSecond;

    private TestDuration rampUpTime;

    private TestDuration plateauTime;

    private TestDuration rampDownTime;

    private Integer baselineVUs;

    private Integer spikeIntensity;

    private Integer volumeTarget;

    public LoadPattern(LoadPatternType type, Integer virtualUsers) {
        this.type = type;
        this.virtualUsers = virtualUsers;
    }

    /**
     * @return {@code true} when virtual users or requests per second is a positive number.
     */
    @JsonIgnore
    public boolean hasPositiveVolume() {
        return (virtualUsers != null && virtualUsers > 0)
                || (requestsPerSecond != null && requestsPerSecond > 0);
    }
}
