package com.microsoft.carbonadvisor.check;

import java.util.List;
import java.util.Map;

/**
 * Counts over one scan's detections, handed to the detection sink alongside the detections.
 */
public record DeploymentSummary(
        int totalDeployments,
        Map<String, Long> byProvider,
        Map<String, Long> byEnvironment,
        List<String> configTypes,
        int highCarbonCount
) {

    public static DeploymentSummary empty() {
        return new DeploymentSummary(0, Map.of(), Map.of(), List.of(), 0);
    }

    public int providerCount() {
        return byProvider.size();
    }

    public int environmentCount() {
        return byEnvironment.size();
    }
}
