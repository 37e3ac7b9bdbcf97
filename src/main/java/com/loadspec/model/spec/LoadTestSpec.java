package com.loadspec.model.spec;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * The structured load test produced by the parsing pipeline.
 * <p>
 * Invariants once a spec leaves the pipeline: {@code requests} is non-empty, {@code loadPattern}
 * specifies virtual users or requests per second, and {@code duration} is positive.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class LoadTestSpec {

    private String id;

    private String name;

    private String description;

    private TestType testType;

    private List<RequestSpec> requests = new ArrayList<>();

    private LoadPattern loadPattern;

    private TestDuration duration;

    /**
     * @return The first request, or {@code null} when none were parsed.
     */
    @JsonIgnore
    public RequestSpec primaryRequest() {
        return requests == null || requests.isEmpty() ? null : requests.get(0);
    }

    /**
     * Checks the structural invariants every returned spec must satisfy.
     *
     * @return {@code true} if the spec is usable as-is.
     */
    @JsonIgnore
    public boolean isUsable() {
        return requests != null && !requests.isEmpty()
                && loadPattern != null && loadPattern.hasPositiveVolume()
                && duration != null && duration.isPositive();
    }
}
