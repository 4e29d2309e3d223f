package com.microsoft.carbonadvisor.check;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.microsoft.carbonadvisor.domain.model.CarbonRecommendation;
import com.microsoft.carbonadvisor.domain.model.EnrichedDeployment;

import java.time.Instant;
import java.util.List;

/**
 * Everything one deployment check produces, ready for display or JSON output.
 */
public record DeploymentCheckResult(
        String target,
        Instant timestamp,
        List<EnrichedDeployment> deployments,
        Stats stats,
        DeploymentSummary summary,
        List<CarbonRecommendation> recommendations,
        @JsonProperty("totalKgCO2PerYear") double totalKgCo2PerYear
) {

    public record Stats(
            int deploymentCount,
            int providerCount,
            int highCarbonCount,
            int environmentCount
    ) {
        static Stats of(DeploymentSummary summary) {
            return new Stats(
                    summary.totalDeployments(),
                    summary.providerCount(),
                    summary.highCarbonCount(),
                    summary.environmentCount());
        }
    }

    public boolean hasRecommendations() {
        return !recommendations.isEmpty();
    }
}
