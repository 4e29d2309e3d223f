package com.microsoft.carbonadvisor.check;

import com.microsoft.carbonadvisor.CarbonFixtures;
import com.microsoft.carbonadvisor.domain.model.CloudProvider;
import com.microsoft.carbonadvisor.domain.model.DeploymentCandidate;
import com.microsoft.carbonadvisor.domain.model.DeploymentEnvironment;
import com.microsoft.carbonadvisor.domain.model.EnrichedDeployment;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DeploymentAggregatorTest {

    private final DeploymentAggregator aggregator = new DeploymentAggregator();

    @Test
    void shouldCountByProviderAndEnvironment() {
        List<EnrichedDeployment> deployments = List.of(
                deployment(CloudProvider.AWS, DeploymentEnvironment.PRODUCTION, "terraform", 612),
                deployment(CloudProvider.AWS, DeploymentEnvironment.STAGING, "github-actions", 385),
                deployment(CloudProvider.GCP, DeploymentEnvironment.PRODUCTION, "terraform", 445),
                deployment(CloudProvider.NETLIFY, DeploymentEnvironment.PRODUCTION, "netlify", null));

        DeploymentSummary summary = aggregator.summarize(deployments);

        assertThat(summary.totalDeployments()).isEqualTo(4);
        assertThat(summary.byProvider()).isEqualTo(Map.of("aws", 2L, "gcp", 1L, "netlify", 1L));
        assertThat(summary.byEnvironment()).isEqualTo(Map.of("production", 3L, "staging", 1L));
        assertThat(summary.configTypes()).containsExactly("github-actions", "netlify", "terraform");
        assertThat(summary.highCarbonCount()).isEqualTo(2);
        assertThat(summary.providerCount()).isEqualTo(3);
        assertThat(summary.environmentCount()).isEqualTo(2);
    }

    @Test
    void shouldSummariseEmptyScanAsZeroes() {
        DeploymentSummary summary = aggregator.summarize(List.of());

        assertThat(summary.totalDeployments()).isZero();
        assertThat(summary.byProvider()).isEmpty();
        assertThat(summary.configTypes()).isEmpty();
        assertThat(summary.highCarbonCount()).isZero();
    }

    private static EnrichedDeployment deployment(CloudProvider provider,
                                                 DeploymentEnvironment environment,
                                                 String configType,
                                                 Integer intensity) {
        DeploymentCandidate candidate = CarbonFixtures.candidate(provider, "region-1").toBuilder()
                .environment(environment)
                .configType(configType)
                .build();
        return EnrichedDeployment.of(candidate, null, Map.of(), null, intensity);
    }
}
