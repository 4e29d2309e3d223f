package com.microsoft.carbonadvisor.domain.model;

import lombok.Builder;

/**
 * Suggestion to move a deployment to a lower-intensity region of the same provider.
 *
 * Only ever created when {@code suggestedIntensity < currentIntensity}, so
 * {@code potentialSavingsPercent} lies in [0, 100].
 */
@Builder
public record CarbonRecommendation(
        String deploymentRef,
        String currentRegion,
        String currentGridZone,
        int currentIntensity,
        CloudProvider suggestedProvider,
        String suggestedRegion,
        String suggestedGridZone,
        String suggestedCountry,
        int suggestedIntensity,
        int potentialSavingsPercent,
        String notes
) {}
