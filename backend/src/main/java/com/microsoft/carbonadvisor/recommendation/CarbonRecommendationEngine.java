package com.microsoft.carbonadvisor.recommendation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.microsoft.carbonadvisor.carbon.CarbonIntensityService;
import com.microsoft.carbonadvisor.carbon.CarbonIntensityService.RegionIntensity;
import com.microsoft.carbonadvisor.config.CarbonAdvisorProperties;
import com.microsoft.carbonadvisor.domain.model.CarbonRecommendation;
import com.microsoft.carbonadvisor.domain.model.EnrichedDeployment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Suggests lower-carbon regions for detected deployments.
 *
 * DECISION FLOW:
 * 1. Resolve the deployment's current grid zone and intensity
 * 2. Rank every region of the same provider that has intensity data
 * 3. Keep regions strictly below the current intensity
 * 4. Recommend the lowest survivor, if any
 *
 * Cross-provider moves are never suggested. A deployment already in its provider's cleanest
 * known region gets no recommendation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CarbonRecommendationEngine {

    private static final int DAYS_PER_YEAR = 365;
    private static final double GRAMS_PER_KILOGRAM = 1000.0;

    private final CarbonIntensityService carbonIntensityService;
    private final CarbonAdvisorProperties properties;

    /**
     * One recommendation per deployment that has a strictly cleaner alternative, in input order.
     */
    public List<CarbonRecommendation> getRecommendations(List<EnrichedDeployment> deployments) {
        List<CarbonRecommendation> recommendations = new ArrayList<>();
        for (EnrichedDeployment deployment : deployments) {
            recommend(deployment).ifPresent(recommendations::add);
        }
        log.debug("Generated {} recommendations for {} deployments", recommendations.size(), deployments.size());
        return recommendations;
    }

    public Optional<CarbonRecommendation> recommend(EnrichedDeployment deployment) {
        if (deployment.provider() == null || deployment.region() == null) {
            return Optional.empty();
        }

        Optional<RegionIntensity> current = carbonIntensityService.resolveRegion(
                deployment.provider(), deployment.region());
        if (current.isEmpty()) {
            return Optional.empty();
        }
        int currentIntensity = current.get().intensity();

        // ranked ascending, so the first strictly lower entry is the minimum
        return carbonIntensityService.getRegionsRankedByIntensity(deployment.provider()).stream()
                .filter(candidate -> candidate.intensity() < currentIntensity)
                .findFirst()
                .map(best -> toRecommendation(deployment, current.get(), best));
    }

    /**
     * Annualised CO2 savings if every recommendation were applied, assuming a constant
     * {@code carbon-advisor.recommendations.daily-energy-kwh} workload per deployment.
     */
    public SavingsEstimate calculatePotentialSavings(List<EnrichedDeployment> deployments) {
        List<CarbonRecommendation> recommendations = getRecommendations(deployments);
        return estimate(recommendations);
    }

    public SavingsEstimate estimate(List<CarbonRecommendation> recommendations) {
        double dailyEnergyKwh = properties.getRecommendations().getDailyEnergyKwh();
        double totalGrams = 0;
        for (CarbonRecommendation recommendation : recommendations) {
            int delta = recommendation.currentIntensity() - recommendation.suggestedIntensity();
            totalGrams += delta * DAYS_PER_YEAR * dailyEnergyKwh;
        }
        return new SavingsEstimate(totalGrams / GRAMS_PER_KILOGRAM, List.copyOf(recommendations));
    }

    private CarbonRecommendation toRecommendation(EnrichedDeployment deployment,
                                                  RegionIntensity current,
                                                  RegionIntensity suggested) {
        int savingsPercent = (int) Math.round(
                (current.intensity() - suggested.intensity()) / (double) current.intensity() * 100);

        return CarbonRecommendation.builder()
                .deploymentRef(deployment.reference())
                .currentRegion(current.region())
                .currentGridZone(current.gridZone())
                .currentIntensity(current.intensity())
                .suggestedProvider(suggested.provider())
                .suggestedRegion(suggested.region())
                .suggestedGridZone(suggested.gridZone())
                .suggestedCountry(suggested.country())
                .suggestedIntensity(suggested.intensity())
                .potentialSavingsPercent(savingsPercent)
                .notes(buildNotes(current, suggested))
                .build();
    }

    private String buildNotes(RegionIntensity current, RegionIntensity suggested) {
        StringBuilder notes = new StringBuilder()
                .append("Move from ").append(current.location())
                .append(" (").append(current.gridZone()).append(", ")
                .append(current.intensity()).append(" gCO2/kWh) to ")
                .append(suggested.location())
                .append(" (").append(suggested.gridZone()).append(", ")
                .append(suggested.intensity()).append(" gCO2/kWh)");
        if (suggested.notes() != null && !suggested.notes().isBlank()) {
            notes.append(". ").append(suggested.notes());
        }
        return notes.toString();
    }

    /**
     * Aggregate estimate over a set of recommendations; kilograms of CO2 per year.
     */
    public record SavingsEstimate(
            @JsonProperty("totalKgCO2PerYear") double totalKgCo2PerYear,
            List<CarbonRecommendation> recommendations
    ) {
        public static SavingsEstimate empty() {
            return new SavingsEstimate(0.0, List.of());
        }
    }
}
