package com.microsoft.carbonadvisor.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An electricity grid zone with its average carbon intensity in gCO2eq/kWh.
 *
 * Zone keys follow ISO 3166-1 alpha-2 for national grids, with suffixes for sub-national
 * grids (US-CAL-CISO, NO-NO1, JP-TK).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GridZone(
        @JsonProperty("zone_key") String zoneKey,
        @JsonProperty("country") String country,
        @JsonProperty("zone_name") String zoneName,
        @JsonProperty("fallback_zone_key") String fallbackZoneKey,
        @JsonProperty("stable") boolean stable,
        @JsonProperty("free") boolean free,
        @JsonProperty("average_co2") double averageCo2,
        @JsonProperty("low_average") boolean lowAverage
) {

    /**
     * Average intensity rounded to the nearest whole gram.
     */
    public int roundedIntensity() {
        return (int) Math.round(averageCo2);
    }
}
