package com.microsoft.carbonadvisor.sink;

import com.microsoft.carbonadvisor.check.DeploymentSummary;
import com.microsoft.carbonadvisor.domain.model.EnrichedDeployment;

import java.util.List;

/**
 * Storage handoff for scan results.
 *
 * The scanner and recommendation engine never persist anything themselves; callers that want
 * history pass detections here together with the project they belong to.
 */
public interface DeploymentDetectionSink {

    /**
     * Stores detections for a project.
     *
     * @param detections enriched detections from one scan
     * @param projectId  owning project
     * @param source     caller that produced the scan
     * @return generated ids, in detection order
     */
    List<Long> save(List<EnrichedDeployment> detections, String projectId, String source);

    /**
     * Stores the scan summary. Sinks that keep no scan history ignore it.
     */
    default void saveSummary(DeploymentSummary summary, String projectId, String source) {
    }
}
