package com.microsoft.carbonadvisor.domain.model;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A provider/region reference detected in a configuration file, before carbon enrichment.
 *
 * Candidates are produced per scan and never persisted by the engine. Region and country
 * are nullable: several PaaS providers do not expose a region in their config files.
 */
@Builder(toBuilder = true)
public record DeploymentCandidate(
        String name,
        DeploymentEnvironment environment,
        CloudProvider provider,
        String region,
        String country,
        String detectionMethod,
        String configFilePath,
        String configType,
        Map<String, Object> metadata
) {

    public static final String CONFIG_FILE_DETECTION = "config_file";

    public DeploymentCandidate {
        environment = environment != null ? environment : DeploymentEnvironment.UNKNOWN;
        detectionMethod = detectionMethod != null ? detectionMethod : CONFIG_FILE_DETECTION;
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }
}
