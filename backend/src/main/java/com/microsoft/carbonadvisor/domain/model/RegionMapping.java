package com.microsoft.carbonadvisor.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Ties a provider's native region code to the grid zone that powers it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RegionMapping(
        @JsonProperty("provider") String provider,
        @JsonProperty("region") String region,
        @JsonProperty("grid_zone") String gridZone,
        @JsonProperty("location") String location,
        @JsonProperty("country") String country,
        @JsonProperty("notes") String notes
) {

    public GridMapping toGridMapping() {
        return new GridMapping(gridZone, location, notes);
    }
}
