package com.microsoft.carbonadvisor.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Summary of one persisted scan: headline counts as columns, the full summary as JSON.
 */
@Entity
@Table(name = "deployment_scans", indexes = {
    @Index(name = "idx_deployment_scan_project", columnList = "projectId, scannedAt")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeploymentScan {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 128)
    private String projectId;

    @Column(nullable = false, length = 64)
    private String source;

    @Column(nullable = false)
    private Integer totalDeployments;

    @Column(nullable = false)
    private Integer providerCount;

    @Column(nullable = false)
    private Integer highCarbonCount;

    @Column(columnDefinition = "TEXT")
    private String summary;

    @Column(nullable = false)
    private LocalDateTime scannedAt;

    @PrePersist
    protected void onCreate() {
        if (scannedAt == null) {
            scannedAt = LocalDateTime.now();
        }
    }
}
