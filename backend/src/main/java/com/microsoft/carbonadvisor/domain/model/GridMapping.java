package com.microsoft.carbonadvisor.domain.model;

/**
 * Explanation attached to an enriched deployment's metadata under {@code gridMapping}.
 */
public record GridMapping(
        String gridZone,
        String location,
        String notes
) {}
