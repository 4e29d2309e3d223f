package com.microsoft.carbonadvisor.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.carbonadvisor.check.DeploymentSummary;
import com.microsoft.carbonadvisor.domain.model.DeploymentEnvironment;
import com.microsoft.carbonadvisor.domain.model.DeploymentScan;
import com.microsoft.carbonadvisor.domain.model.DetectedDeployment;
import com.microsoft.carbonadvisor.domain.model.EnrichedDeployment;
import com.microsoft.carbonadvisor.domain.repository.DeploymentScanRepository;
import com.microsoft.carbonadvisor.domain.repository.DetectedDeploymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Persists detections and scan summaries through Spring Data JPA.
 *
 * All detections of one call share a single {@code detectedAt} timestamp. Text taken from scanned
 * files is cut to the column length so that an oversized value cannot fail the whole batch; the
 * untruncated detection is still returned to the caller by the check service.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaDeploymentDetectionSink implements DeploymentDetectionSink {

    private final DetectedDeploymentRepository detectedDeploymentRepository;
    private final DeploymentScanRepository deploymentScanRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional
    public List<Long> save(List<EnrichedDeployment> detections, String projectId, String source) {
        Objects.requireNonNull(projectId, "projectId");
        Objects.requireNonNull(source, "source");
        if (detections.isEmpty()) {
            return List.of();
        }

        LocalDateTime detectedAt = LocalDateTime.now();
        List<DetectedDeployment> entities = detections.stream()
                .map(detection -> toEntity(detection, projectId, source, detectedAt))
                .toList();

        List<Long> ids = detectedDeploymentRepository.saveAll(entities).stream()
                .map(DetectedDeployment::getId)
                .toList();

        log.info("Saved {} detections for project {} from {}", ids.size(), projectId, source);
        return ids;
    }

    @Override
    @Transactional
    public void saveSummary(DeploymentSummary summary, String projectId, String source) {
        deploymentScanRepository.save(DeploymentScan.builder()
                .projectId(projectId)
                .source(source)
                .totalDeployments(summary.totalDeployments())
                .providerCount(summary.providerCount())
                .highCarbonCount(summary.highCarbonCount())
                .summary(toJson(summary))
                .build());
    }

    private DetectedDeployment toEntity(EnrichedDeployment detection,
                                        String projectId,
                                        String source,
                                        LocalDateTime detectedAt) {
        return DetectedDeployment.builder()
                .projectId(projectId)
                .source(source)
                .name(fit(detection.name(), DetectedDeployment.NAME_LENGTH))
                .environment(detection.environment() != null
                        ? detection.environment()
                        : DeploymentEnvironment.UNKNOWN)
                .provider(detection.provider())
                .region(fit(detection.region(), DetectedDeployment.REGION_LENGTH))
                .country(detection.country())
                .detectionMethod(fit(detection.detectionMethod(), DetectedDeployment.DETECTION_METHOD_LENGTH))
                .configFilePath(fit(detection.configFilePath(), DetectedDeployment.CONFIG_FILE_PATH_LENGTH))
                .configType(fit(detection.configType(), DetectedDeployment.CONFIG_TYPE_LENGTH))
                .gridZone(fit(detection.gridZone(), DetectedDeployment.GRID_ZONE_LENGTH))
                .carbonIntensity(detection.carbonIntensity())
                .metadata(toJson(detection.metadata()))
                .detectedAt(detectedAt)
                .build();
    }

    static String fit(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        log.warn("Truncating {}-character value to {} characters: {}...",
                value.length(), maxLength, value.substring(0, Math.min(32, maxLength)));
        return value.substring(0, maxLength);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
