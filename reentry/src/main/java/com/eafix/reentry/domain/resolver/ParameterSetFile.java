package com.eafix.reentry.domain.resolver;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Top-level shape of {@code parameter_sets.json}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParameterSetFile(
    @JsonProperty("parameter_sets") List<ParameterSet> parameterSets,
    @JsonProperty("last_updated") Instant lastUpdated,
    @JsonProperty("version") String version
) {
    public ParameterSetFile {
        parameterSets = parameterSets != null ? List.copyOf(parameterSets) : List.of();
    }
}
