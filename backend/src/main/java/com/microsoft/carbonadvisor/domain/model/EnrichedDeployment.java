package com.microsoft.carbonadvisor.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A deployment candidate joined against the region mapping and grid zone tables.
 *
 * {@code gridZone} is set whenever the (provider, region) pair is mapped; {@code carbonIntensity}
 * only when the grid zone also has intensity data. Both stay null on a lookup miss.
 */
public record EnrichedDeployment(
        String name,
        DeploymentEnvironment environment,
        CloudProvider provider,
        String region,
        String country,
        String detectionMethod,
        String configFilePath,
        String configType,
        Map<String, Object> metadata,
        String gridZone,
        Integer carbonIntensity
) {

    public static final String GRID_MAPPING_KEY = "gridMapping";

    public EnrichedDeployment {
        if (carbonIntensity != null && carbonIntensity < 0) {
            throw new IllegalArgumentException("carbonIntensity must be non-negative: " + carbonIntensity);
        }
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    /**
     * Candidate with no grid data attached.
     */
    public static EnrichedDeployment unmapped(DeploymentCandidate candidate) {
        return of(candidate, candidate.country(), candidate.metadata(), null, null);
    }

    public static EnrichedDeployment of(DeploymentCandidate candidate,
                                        String country,
                                        Map<String, Object> metadata,
                                        String gridZone,
                                        Integer carbonIntensity) {
        return new EnrichedDeployment(
                candidate.name(),
                candidate.environment(),
                candidate.provider(),
                candidate.region(),
                country,
                candidate.detectionMethod(),
                candidate.configFilePath(),
                candidate.configType(),
                metadata,
                gridZone,
                carbonIntensity
        );
    }

    /**
     * Stable reference used by recommendations: provider, region and the config file it came from.
     */
    public String reference() {
        String providerId = provider != null ? provider.getId() : "unknown";
        String regionCode = region != null ? region : "-";
        return providerId + ":" + regionCode + "@" + configFilePath;
    }
}
