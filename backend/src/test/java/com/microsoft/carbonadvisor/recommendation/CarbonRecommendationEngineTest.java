package com.microsoft.carbonadvisor.recommendation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.carbonadvisor.CarbonFixtures;
import com.microsoft.carbonadvisor.carbon.CarbonIntensityService;
import com.microsoft.carbonadvisor.config.CarbonAdvisorProperties;
import com.microsoft.carbonadvisor.data.CarbonDatasetLoader;
import com.microsoft.carbonadvisor.data.GridZoneTable;
import com.microsoft.carbonadvisor.data.RegionMappingTable;
import com.microsoft.carbonadvisor.domain.model.CarbonRecommendation;
import com.microsoft.carbonadvisor.domain.model.CloudProvider;
import com.microsoft.carbonadvisor.domain.model.EnrichedDeployment;
import com.microsoft.carbonadvisor.domain.model.RegionMapping;
import com.microsoft.carbonadvisor.enrichment.DeploymentEnricher;
import com.microsoft.carbonadvisor.recommendation.CarbonRecommendationEngine.SavingsEstimate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for CarbonRecommendationEngine.
 *
 * Test strategy:
 * 1. Same-provider suggestions against a small fixture table
 * 2. No suggestion when nothing strictly cleaner exists
 * 3. Savings arithmetic
 * 4. Recommendation invariants over the bundled datasets
 */
class CarbonRecommendationEngineTest {

    private CarbonAdvisorProperties properties;
    private CarbonRecommendationEngine engine;

    @BeforeEach
    void setUp() {
        properties = new CarbonAdvisorProperties();
        CarbonIntensityService intensityService = new CarbonIntensityService(
                CarbonFixtures.gridZones(), CarbonFixtures.regionMappings(), properties);
        engine = new CarbonRecommendationEngine(intensityService, properties);
    }

    @Nested
    @DisplayName("Recommendation Tests")
    class RecommendationTests {

        @Test
        @DisplayName("Should suggest the provider's cleanest region for a high-carbon deployment")
        void shouldSuggestCleanestRegion() {
            EnrichedDeployment sydney = CarbonFixtures.enriched(CloudProvider.AWS, "ap-southeast-2", "AU-NSW", 612);

            List<CarbonRecommendation> result = engine.getRecommendations(List.of(sydney));

            assertThat(result).singleElement().satisfies(recommendation -> {
                assertThat(recommendation.deploymentRef()).isEqualTo("aws:ap-southeast-2@/repo/infra/main.tf");
                assertThat(recommendation.currentRegion()).isEqualTo("ap-southeast-2");
                assertThat(recommendation.currentGridZone()).isEqualTo("AU-NSW");
                assertThat(recommendation.currentIntensity()).isEqualTo(612);
                assertThat(recommendation.suggestedProvider()).isEqualTo(CloudProvider.AWS);
                assertThat(recommendation.suggestedRegion()).isEqualTo("eu-north-1");
                assertThat(recommendation.suggestedGridZone()).isEqualTo("SE");
                assertThat(recommendation.suggestedCountry()).isEqualTo("SE");
                assertThat(recommendation.suggestedIntensity()).isEqualTo(25);
                assertThat(recommendation.potentialSavingsPercent()).isEqualTo(96);
                assertThat(recommendation.notes()).contains("Stockholm").contains("Sydney");
            });
        }

        @Test
        @DisplayName("Should never suggest another provider's region")
        void shouldStayWithinProvider() {
            EnrichedDeployment iowa = CarbonFixtures.enriched(CloudProvider.GCP, "us-central1", "US-MIDW-MISO", 445);

            assertThat(engine.recommend(iowa)).hasValueSatisfying(recommendation -> {
                assertThat(recommendation.suggestedProvider()).isEqualTo(CloudProvider.GCP);
                assertThat(recommendation.suggestedRegion()).isEqualTo("europe-north1");
                assertThat(recommendation.potentialSavingsPercent()).isEqualTo(82);
            });
        }

        @Test
        @DisplayName("Should not recommend when already in the cleanest region")
        void shouldSkipOptimalDeployment() {
            EnrichedDeployment stockholm = CarbonFixtures.enriched(CloudProvider.AWS, "eu-north-1", "SE", 25);

            assertThat(engine.getRecommendations(List.of(stockholm))).isEmpty();
        }

        @Test
        @DisplayName("Should not recommend for unmapped, regionless or intensity-less deployments")
        void shouldSkipUnresolvableDeployments() {
            List<EnrichedDeployment> deployments = List.of(
                    CarbonFixtures.enriched(CloudProvider.AWS, "me-south-1", null, null),
                    CarbonFixtures.enriched(CloudProvider.AWS, "xx-nowhere-1", "ZZ", null),
                    EnrichedDeployment.unmapped(CarbonFixtures.candidate(CloudProvider.NETLIFY, "edge")
                            .toBuilder().region(null).build()));

            assertThat(engine.getRecommendations(deployments)).isEmpty();
        }

        @Test
        @DisplayName("Equal-intensity candidates resolve to the first in dataset order")
        void shouldBreakTiesByDatasetOrder() {
            CarbonIntensityService tied = new CarbonIntensityService(
                    new GridZoneTable(List.of(
                            CarbonFixtures.zone("A", 50.0),
                            CarbonFixtures.zone("B", 50.0),
                            CarbonFixtures.zone("C", 300.0))),
                    new RegionMappingTable(List.of(
                            CarbonFixtures.mapping("aws", "ca-central-1", "C", "Montreal", "CA"),
                            CarbonFixtures.mapping("aws", "eu-west-3", "A", "Paris", "FR"),
                            CarbonFixtures.mapping("aws", "eu-north-1", "B", "Stockholm", "SE"))),
                    properties);
            CarbonRecommendationEngine tiedEngine = new CarbonRecommendationEngine(tied, properties);

            assertThat(tiedEngine.recommend(CarbonFixtures.enriched(CloudProvider.AWS, "ca-central-1", "C", 300)))
                    .hasValueSatisfying(recommendation ->
                            assertThat(recommendation.suggestedRegion()).isEqualTo("eu-west-3"));
        }
    }

    @Nested
    @DisplayName("Savings Tests")
    class SavingsTests {

        @Test
        @DisplayName("Should annualise intensity deltas into kilograms")
        void shouldSumAnnualSavings() {
            List<EnrichedDeployment> deployments = List.of(
                    CarbonFixtures.enriched(CloudProvider.AWS, "ap-southeast-2", "AU-NSW", 612),
                    CarbonFixtures.enriched(CloudProvider.AWS, "eu-north-1", "SE", 25));

            SavingsEstimate estimate = engine.calculatePotentialSavings(deployments);

            assertThat(estimate.recommendations()).hasSize(1);
            assertThat(estimate.totalKgCo2PerYear()).isCloseTo((612 - 25) * 365 / 1000.0, within(1e-9));
        }

        @Test
        void shouldScaleWithDailyEnergy() {
            properties.getRecommendations().setDailyEnergyKwh(2.0);

            SavingsEstimate estimate = engine.calculatePotentialSavings(List.of(
                    CarbonFixtures.enriched(CloudProvider.AWS, "us-east-1", "US-MIDA-PJM", 385)));

            assertThat(estimate.totalKgCo2PerYear()).isCloseTo((385 - 25) * 365 * 2.0 / 1000.0, within(1e-9));
        }

        @Test
        @DisplayName("Should return zero for no deployments")
        void shouldReturnZeroForEmptyInput() {
            SavingsEstimate estimate = engine.calculatePotentialSavings(List.of());

            assertThat(estimate.totalKgCo2PerYear()).isZero();
            assertThat(estimate.recommendations()).isEmpty();
        }

        @Test
        void shouldSerialiseTotalWithItsPublicName() throws Exception {
            String json = new ObjectMapper().writeValueAsString(SavingsEstimate.empty());

            assertThat(json).contains("\"totalKgCO2PerYear\":0.0");
        }
    }

    @Test
    @DisplayName("Every recommendation over the bundled data is strictly cleaner with savings in [0, 100]")
    void recommendationsAreAlwaysStrictlyCleaner() {
        CarbonDatasetLoader loader = new CarbonDatasetLoader(new ObjectMapper(), new DefaultResourceLoader());
        GridZoneTable zones = loader.loadGridZones("classpath:data/grid-zones.json");
        RegionMappingTable mappings = loader.loadRegionMappings("classpath:data/region-mappings.json");
        DeploymentEnricher enricher = new DeploymentEnricher(mappings, zones);
        CarbonRecommendationEngine bundled = new CarbonRecommendationEngine(
                new CarbonIntensityService(zones, mappings, properties), properties);

        List<EnrichedDeployment> deployments = new ArrayList<>();
        for (CloudProvider provider : mappings.providers()) {
            for (RegionMapping mapping : mappings.regionsFor(provider)) {
                deployments.add(enricher.enrich(CarbonFixtures.candidate(provider, mapping.region())));
            }
        }

        List<CarbonRecommendation> recommendations = bundled.getRecommendations(deployments);

        assertThat(recommendations).isNotEmpty();
        assertThat(recommendations).allSatisfy(recommendation -> {
            assertThat(recommendation.suggestedIntensity()).isLessThan(recommendation.currentIntensity());
            assertThat(recommendation.potentialSavingsPercent()).isBetween(0, 100);
            assertThat(recommendation.currentRegion()).isNotEqualTo(recommendation.suggestedRegion());
        });
    }
}
