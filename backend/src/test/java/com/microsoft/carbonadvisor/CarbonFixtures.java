package com.microsoft.carbonadvisor;

import com.microsoft.carbonadvisor.data.GridZoneTable;
import com.microsoft.carbonadvisor.data.RegionMappingTable;
import com.microsoft.carbonadvisor.domain.model.CloudProvider;
import com.microsoft.carbonadvisor.domain.model.DeploymentCandidate;
import com.microsoft.carbonadvisor.domain.model.EnrichedDeployment;
import com.microsoft.carbonadvisor.domain.model.GridZone;
import com.microsoft.carbonadvisor.domain.model.RegionMapping;

import java.util.List;
import java.util.Map;

/**
 * Small hand-built grid zone and region mapping tables shared by unit tests.
 *
 * AWS: eu-north-1 (SE, 25) is the cleanest region, ap-southeast-2 (AU-NSW, 612) the dirtiest.
 * GCP: europe-north1 (FI, 79) and us-central1 (US-MIDW-MISO, 445).
 */
public final class CarbonFixtures {

    private CarbonFixtures() {
    }

    public static GridZone zone(String key, double averageCo2) {
        return new GridZone(key, key, key + " grid", null, true, true, averageCo2, averageCo2 < 100);
    }

    public static RegionMapping mapping(String provider, String region, String zone, String location, String country) {
        return new RegionMapping(provider, region, zone, location, country, null);
    }

    public static GridZoneTable gridZones() {
        return new GridZoneTable(List.of(
                zone("SE", 25.3),
                zone("IE", 290.0),
                zone("DE", 380.6),
                zone("US-MIDA-PJM", 384.5),
                zone("AU-NSW", 611.7),
                zone("FI", 79.4),
                zone("US-MIDW-MISO", 445.2),
                zone("NO-NO1", 29.7),
                zone("NO-NO2", 20.3)
        ));
    }

    public static RegionMappingTable regionMappings() {
        return new RegionMappingTable(List.of(
                mapping("aws", "us-east-1", "US-MIDA-PJM", "N. Virginia", "US"),
                mapping("aws", "eu-west-1", "IE", "Ireland", "IE"),
                mapping("aws", "eu-central-1", "DE", "Frankfurt", "DE"),
                mapping("aws", "eu-north-1", "SE", "Stockholm", "SE"),
                mapping("aws", "ap-southeast-2", "AU-NSW", "Sydney", "AU"),
                mapping("aws", "xx-nowhere-1", "ZZ", "Nowhere", null),
                mapping("gcp", "us-central1", "US-MIDW-MISO", "Iowa", "US"),
                mapping("gcp", "europe-north1", "FI", "Finland", "FI")
        ));
    }

    public static DeploymentCandidate candidate(CloudProvider provider, String region) {
        return DeploymentCandidate.builder()
                .name(provider.getDisplayName() + " " + region)
                .provider(provider)
                .region(region)
                .configFilePath("/repo/infra/main.tf")
                .configType("terraform")
                .build();
    }

    public static EnrichedDeployment enriched(CloudProvider provider, String region, String zone, Integer intensity) {
        return EnrichedDeployment.of(candidate(provider, region), null, Map.of(), zone, intensity);
    }
}
