package com.microsoft.carbonadvisor.enrichment;

import com.microsoft.carbonadvisor.data.GridZoneTable;
import com.microsoft.carbonadvisor.data.RegionMappingTable;
import com.microsoft.carbonadvisor.domain.model.DeploymentCandidate;
import com.microsoft.carbonadvisor.domain.model.EnrichedDeployment;
import com.microsoft.carbonadvisor.domain.model.GridZone;
import com.microsoft.carbonadvisor.domain.model.RegionMapping;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Attaches grid zone and carbon intensity to deployment candidates.
 *
 * JOIN:
 * 1. (provider, region) → region mapping (exact, case-sensitive region code)
 * 2. grid zone key → average intensity, rounded to whole grams
 *
 * A miss at either step is expected for unmapped providers or regions and simply leaves
 * the corresponding fields null.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeploymentEnricher {

    private final RegionMappingTable regionMappings;
    private final GridZoneTable gridZones;

    public EnrichedDeployment enrich(DeploymentCandidate candidate) {
        if (candidate.provider() == null || candidate.region() == null) {
            return EnrichedDeployment.unmapped(candidate);
        }

        Optional<RegionMapping> mapping = regionMappings.find(candidate.provider(), candidate.region());
        if (mapping.isEmpty()) {
            log.debug("No grid mapping for {}/{}", candidate.provider().getId(), candidate.region());
            return EnrichedDeployment.unmapped(candidate);
        }

        RegionMapping regionMapping = mapping.get();
        Map<String, Object> metadata = new LinkedHashMap<>(candidate.metadata());
        metadata.put(EnrichedDeployment.GRID_MAPPING_KEY, regionMapping.toGridMapping());

        String country = candidate.country() != null ? candidate.country() : regionMapping.country();
        Integer intensity = gridZones.find(regionMapping.gridZone())
                .map(GridZone::roundedIntensity)
                .orElse(null);
        if (intensity == null) {
            log.debug("Grid zone {} has no intensity data", regionMapping.gridZone());
        }

        return EnrichedDeployment.of(candidate, country, metadata, regionMapping.gridZone(), intensity);
    }
}
