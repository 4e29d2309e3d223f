package com.microsoft.carbonadvisor.check;

import com.microsoft.carbonadvisor.carbon.CarbonIntensityService;
import com.microsoft.carbonadvisor.domain.model.CloudProvider;
import com.microsoft.carbonadvisor.domain.model.DeploymentEnvironment;
import com.microsoft.carbonadvisor.domain.model.EnrichedDeployment;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Groups enriched deployments into a {@link DeploymentSummary}.
 */
@Component
public class DeploymentAggregator {

    private static final String UNKNOWN = "unknown";

    public DeploymentSummary summarize(List<EnrichedDeployment> deployments) {
        if (deployments.isEmpty()) {
            return DeploymentSummary.empty();
        }

        Map<String, Long> byProvider = countBy(deployments, d -> providerId(d.provider()));
        Map<String, Long> byEnvironment = countBy(deployments, d -> environmentId(d.environment()));

        List<String> configTypes = deployments.stream()
                .map(EnrichedDeployment::configType)
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .toList();

        int highCarbon = (int) deployments.stream()
                .filter(d -> CarbonIntensityService.isHighCarbon(d.carbonIntensity()))
                .count();

        return new DeploymentSummary(deployments.size(), byProvider, byEnvironment, configTypes, highCarbon);
    }

    private static Map<String, Long> countBy(List<EnrichedDeployment> deployments,
                                             Function<EnrichedDeployment, String> key) {
        Map<String, Long> counts = deployments.stream()
                .collect(Collectors.groupingBy(key, TreeMap::new, Collectors.counting()));
        return Collections.unmodifiableMap(counts);
    }

    private static String providerId(CloudProvider provider) {
        return provider != null ? provider.getId() : UNKNOWN;
    }

    private static String environmentId(DeploymentEnvironment environment) {
        return environment != null ? environment.getId() : UNKNOWN;
    }
}
