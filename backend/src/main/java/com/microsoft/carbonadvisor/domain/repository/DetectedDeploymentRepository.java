package com.microsoft.carbonadvisor.domain.repository;

import com.microsoft.carbonadvisor.domain.model.CloudProvider;
import com.microsoft.carbonadvisor.domain.model.DetectedDeployment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DetectedDeploymentRepository extends JpaRepository<DetectedDeployment, Long> {

    List<DetectedDeployment> findByProjectIdOrderByIdAsc(String projectId);

    List<DetectedDeployment> findByProjectIdAndProvider(String projectId, CloudProvider provider);

    long countByProjectId(String projectId);

    /**
     * Detections above the given intensity, dirtiest first.
     */
    @Query("SELECT d FROM DetectedDeployment d WHERE d.projectId = :projectId " +
           "AND d.carbonIntensity > :threshold ORDER BY d.carbonIntensity DESC")
    List<DetectedDeployment> findAboveIntensity(
            @Param("projectId") String projectId,
            @Param("threshold") int threshold
    );
}
