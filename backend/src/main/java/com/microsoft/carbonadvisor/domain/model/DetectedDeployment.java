package com.microsoft.carbonadvisor.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * A persisted deployment detection.
 *
 * One row per detection per scan; rows are append-only so that successive scans of the same
 * project can be compared. Metadata is stored as the JSON rendering of the detection's metadata map.
 *
 * Free-text values come straight from scanned files; the sink truncates them to the column
 * lengths below.
 */
@Entity
@Table(name = "detected_deployments", indexes = {
    @Index(name = "idx_detected_deployment_project", columnList = "projectId, detectedAt"),
    @Index(name = "idx_detected_deployment_provider_region", columnList = "provider, region")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DetectedDeployment {

    public static final int NAME_LENGTH = 256;
    public static final int REGION_LENGTH = 128;
    public static final int DETECTION_METHOD_LENGTH = 32;
    public static final int CONFIG_FILE_PATH_LENGTH = 2048;
    public static final int CONFIG_TYPE_LENGTH = 64;
    public static final int GRID_ZONE_LENGTH = 64;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 128)
    private String projectId;

    /**
     * Which caller produced the detection (e.g. "startup-scan", "cli").
     */
    @Column(nullable = false, length = 64)
    private String source;

    @Column(nullable = false, length = NAME_LENGTH)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private DeploymentEnvironment environment;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private CloudProvider provider;

    @Column(length = REGION_LENGTH)
    private String region;

    @Column(length = 8)
    private String country;

    @Column(nullable = false, length = DETECTION_METHOD_LENGTH)
    private String detectionMethod;

    @Column(length = CONFIG_FILE_PATH_LENGTH)
    private String configFilePath;

    @Column(length = CONFIG_TYPE_LENGTH)
    private String configType;

    @Column(length = GRID_ZONE_LENGTH)
    private String gridZone;

    /**
     * gCO2eq/kWh at detection time; null when the region is unmapped.
     */
    private Integer carbonIntensity;

    @Column(columnDefinition = "TEXT")
    private String metadata;

    @Column(nullable = false)
    private LocalDateTime detectedAt;

    @PrePersist
    protected void onCreate() {
        if (detectedAt == null) {
            detectedAt = LocalDateTime.now();
        }
    }
}
