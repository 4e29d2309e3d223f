package com.microsoft.carbonadvisor.domain.repository;

import com.microsoft.carbonadvisor.domain.model.DeploymentScan;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DeploymentScanRepository extends JpaRepository<DeploymentScan, Long> {

    Optional<DeploymentScan> findFirstByProjectIdOrderByScannedAtDescIdDesc(String projectId);

    List<DeploymentScan> findByProjectIdOrderByScannedAtAsc(String projectId);
}
