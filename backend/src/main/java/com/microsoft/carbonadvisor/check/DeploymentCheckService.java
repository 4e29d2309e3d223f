package com.microsoft.carbonadvisor.check;

import com.microsoft.carbonadvisor.domain.model.EnrichedDeployment;
import com.microsoft.carbonadvisor.recommendation.CarbonRecommendationEngine;
import com.microsoft.carbonadvisor.recommendation.CarbonRecommendationEngine.SavingsEstimate;
import com.microsoft.carbonadvisor.scanner.DeploymentScanner;
import com.microsoft.carbonadvisor.sink.DeploymentDetectionSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Runs a full deployment check over a directory.
 *
 * FLOW:
 * 1. Scan and enrich every detected deployment
 * 2. Recommend lower-carbon regions
 * 3. Summarise counts and estimate annual savings
 * 4. Optionally hand detections and summary to the detection sink
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeploymentCheckService {

    private final DeploymentScanner scanner;
    private final CarbonRecommendationEngine recommendationEngine;
    private final DeploymentAggregator aggregator;
    private final DeploymentDetectionSink detectionSink;

    public DeploymentCheckResult analyze(Path target) {
        Path absolute = target.toAbsolutePath().normalize();
        log.info("Checking deployments under {}", absolute);

        List<EnrichedDeployment> deployments = scanner.scanDirectory(absolute);
        DeploymentSummary summary = aggregator.summarize(deployments);
        SavingsEstimate savings = recommendationEngine.estimate(
                recommendationEngine.getRecommendations(deployments));

        log.info("Found {} deployments across {} providers, {} high-carbon, {} recommendations",
                summary.totalDeployments(), summary.providerCount(),
                summary.highCarbonCount(), savings.recommendations().size());

        return new DeploymentCheckResult(
                absolute.toString(),
                Instant.now(),
                deployments,
                DeploymentCheckResult.Stats.of(summary),
                summary,
                savings.recommendations(),
                savings.totalKgCo2PerYear()
        );
    }

    /**
     * Like {@link #analyze(Path)}, then stores detections and summary under {@code projectId}.
     * Persistence failures propagate to the caller.
     */
    public DeploymentCheckResult analyzeAndSave(Path target, String projectId, String source) {
        DeploymentCheckResult result = analyze(target);
        List<Long> ids = detectionSink.save(result.deployments(), projectId, source);
        detectionSink.saveSummary(result.summary(), projectId, source);
        log.debug("Stored check of {} as {} detections", result.target(), ids.size());
        return result;
    }
}
