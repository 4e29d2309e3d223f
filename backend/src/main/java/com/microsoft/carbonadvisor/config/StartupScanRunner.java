package com.microsoft.carbonadvisor.config;

import com.microsoft.carbonadvisor.check.DeploymentCheckResult;
import com.microsoft.carbonadvisor.check.DeploymentCheckService;
import com.microsoft.carbonadvisor.domain.model.CarbonRecommendation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Checks the configured directory once on startup and logs the outcome.
 *
 * Does nothing unless {@code carbon-advisor.startup-scan.path} is set. Results are persisted
 * only when a project id is configured as well.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StartupScanRunner implements CommandLineRunner {

    private final DeploymentCheckService checkService;
    private final CarbonAdvisorProperties properties;

    @Override
    public void run(String... args) {
        CarbonAdvisorProperties.StartupScan startupScan = properties.getStartupScan();
        if (isBlank(startupScan.getPath())) {
            log.debug("No startup scan path configured, skipping startup scan");
            return;
        }

        Path target = Path.of(startupScan.getPath());
        DeploymentCheckResult result = isBlank(startupScan.getProjectId())
                ? checkService.analyze(target)
                : checkService.analyzeAndSave(target, startupScan.getProjectId(), startupScan.getSource());

        logResult(result);
    }

    private void logResult(DeploymentCheckResult result) {
        log.info("Startup scan of {}: {} deployments, {} high-carbon",
                result.target(), result.stats().deploymentCount(), result.stats().highCarbonCount());
        for (CarbonRecommendation recommendation : result.recommendations()) {
            log.info("  {} -> {} ({}% lower): {}",
                    recommendation.deploymentRef(),
                    recommendation.suggestedRegion(),
                    recommendation.potentialSavingsPercent(),
                    recommendation.notes());
        }
        if (result.hasRecommendations()) {
            log.info("Estimated savings: {} kg CO2 per year", String.format("%.1f", result.totalKgCo2PerYear()));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
