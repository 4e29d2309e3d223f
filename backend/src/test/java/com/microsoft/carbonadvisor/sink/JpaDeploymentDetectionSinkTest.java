package com.microsoft.carbonadvisor.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.carbonadvisor.CarbonFixtures;
import com.microsoft.carbonadvisor.check.DeploymentSummary;
import com.microsoft.carbonadvisor.domain.model.CloudProvider;
import com.microsoft.carbonadvisor.domain.model.DeploymentEnvironment;
import com.microsoft.carbonadvisor.domain.model.DeploymentScan;
import com.microsoft.carbonadvisor.domain.model.DetectedDeployment;
import com.microsoft.carbonadvisor.domain.model.EnrichedDeployment;
import com.microsoft.carbonadvisor.domain.model.GridMapping;
import com.microsoft.carbonadvisor.domain.repository.DeploymentScanRepository;
import com.microsoft.carbonadvisor.domain.repository.DetectedDeploymentRepository;
import com.microsoft.carbonadvisor.scanner.parsers.VercelParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class JpaDeploymentDetectionSinkTest {

    @Autowired
    private DetectedDeploymentRepository detectedDeploymentRepository;

    @Autowired
    private DeploymentScanRepository deploymentScanRepository;

    private JpaDeploymentDetectionSink sink;

    @BeforeEach
    void setUp() {
        sink = new JpaDeploymentDetectionSink(detectedDeploymentRepository, deploymentScanRepository, new ObjectMapper());
    }

    @Test
    @DisplayName("Should persist detections with their grid data and metadata")
    void shouldSaveDetections() {
        EnrichedDeployment sydney = EnrichedDeployment.of(
                CarbonFixtures.candidate(CloudProvider.AWS, "ap-southeast-2"),
                "AU",
                Map.of(EnrichedDeployment.GRID_MAPPING_KEY, new GridMapping("AU-NSW", "Sydney", null)),
                "AU-NSW",
                612);
        EnrichedDeployment netlify = EnrichedDeployment.unmapped(
                CarbonFixtures.candidate(CloudProvider.NETLIFY, "edge").toBuilder().region(null).build());

        List<Long> ids = sink.save(List.of(sydney, netlify), "shop", "cli");

        assertThat(ids).hasSize(2).doesNotContainNull();
        List<DetectedDeployment> stored = detectedDeploymentRepository.findByProjectIdOrderByIdAsc("shop");
        assertThat(stored).hasSize(2);

        DetectedDeployment first = stored.get(0);
        assertThat(first.getProvider()).isEqualTo(CloudProvider.AWS);
        assertThat(first.getRegion()).isEqualTo("ap-southeast-2");
        assertThat(first.getGridZone()).isEqualTo("AU-NSW");
        assertThat(first.getCarbonIntensity()).isEqualTo(612);
        assertThat(first.getEnvironment()).isEqualTo(DeploymentEnvironment.UNKNOWN);
        assertThat(first.getSource()).isEqualTo("cli");
        assertThat(first.getMetadata()).contains("\"location\":\"Sydney\"");
        assertThat(first.getDetectedAt()).isNotNull();

        assertThat(stored.get(1).getCarbonIntensity()).isNull();
        assertThat(detectedDeploymentRepository.findByProjectIdAndProvider("shop", CloudProvider.NETLIFY))
                .singleElement()
                .satisfies(deployment -> assertThat(deployment.getRegion()).isNull());
        assertThat(detectedDeploymentRepository.findByProjectIdAndProvider("shop", CloudProvider.GCP)).isEmpty();
        assertThat(detectedDeploymentRepository.findAboveIntensity("shop", 400))
                .extracting(DetectedDeployment::getRegion)
                .containsExactly("ap-southeast-2");
    }

    @Test
    @DisplayName("Should truncate oversized values from scanned files to the column lengths")
    void shouldTruncateOversizedValues() {
        String longRegion = "x".repeat(300);
        List<EnrichedDeployment> detections = new VercelParser(new ObjectMapper())
                .parse(Path.of("vercel.json"), "{\"regions\":[\"" + longRegion + "\"]}")
                .stream()
                .map(EnrichedDeployment::unmapped)
                .toList();

        List<Long> ids = sink.save(detections, "shop", "cli");
        detectedDeploymentRepository.flush();

        assertThat(ids).hasSize(1);
        DetectedDeployment stored = detectedDeploymentRepository.findById(ids.get(0)).orElseThrow();
        assertThat(stored.getRegion()).hasSize(DetectedDeployment.REGION_LENGTH).isEqualTo(longRegion.substring(0, 128));
        assertThat(stored.getName()).hasSize(DetectedDeployment.NAME_LENGTH).startsWith("Vercel xxx");
        assertThat(stored.getConfigType()).isEqualTo("vercel");
    }

    @Test
    void shouldLeaveValuesWithinLimitUntouched() {
        assertThat(JpaDeploymentDetectionSink.fit(null, 8)).isNull();
        assertThat(JpaDeploymentDetectionSink.fit("eu-west-1", 9)).isEqualTo("eu-west-1");
        assertThat(JpaDeploymentDetectionSink.fit("eu-west-1", 5)).isEqualTo("eu-we");
    }

    @Test
    void shouldSaveNothingForEmptyScan() {
        assertThat(sink.save(List.of(), "shop", "cli")).isEmpty();
        assertThat(detectedDeploymentRepository.countByProjectId("shop")).isZero();
    }

    @Test
    @DisplayName("Should persist the scan summary as counts plus JSON")
    void shouldSaveSummary() {
        DeploymentSummary summary = new DeploymentSummary(
                3, Map.of("aws", 2L, "gcp", 1L), Map.of("production", 3L), List.of("terraform"), 1);

        sink.saveSummary(summary, "shop", "startup-scan");

        DeploymentScan scan = deploymentScanRepository.findFirstByProjectIdOrderByScannedAtDescIdDesc("shop")
                .orElseThrow();
        assertThat(scan.getTotalDeployments()).isEqualTo(3);
        assertThat(scan.getProviderCount()).isEqualTo(2);
        assertThat(scan.getHighCarbonCount()).isEqualTo(1);
        assertThat(scan.getSummary()).contains("\"configTypes\":[\"terraform\"]");
    }

    @Test
    @DisplayName("Should keep every scan summary as project history")
    void shouldKeepScanHistory() {
        sink.saveSummary(new DeploymentSummary(1, Map.of("aws", 1L), Map.of(), List.of("terraform"), 0),
                "shop", "cli");
        sink.saveSummary(new DeploymentSummary(2, Map.of("gcp", 2L), Map.of(), List.of("app.yaml"), 1),
                "shop", "cli");
        sink.saveSummary(new DeploymentSummary(5, Map.of(), Map.of(), List.of(), 0), "other", "cli");

        List<DeploymentScan> history = deploymentScanRepository.findByProjectIdOrderByScannedAtAsc("shop");

        assertThat(history).hasSize(2)
                .allSatisfy(scan -> assertThat(scan.getScannedAt()).isNotNull())
                .extracting(DeploymentScan::getTotalDeployments)
                .containsExactlyInAnyOrder(1, 2);
        assertThat(history.get(0).getScannedAt()).isBeforeOrEqualTo(history.get(1).getScannedAt());
    }
}
