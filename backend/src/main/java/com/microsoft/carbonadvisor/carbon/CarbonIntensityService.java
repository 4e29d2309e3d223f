package com.microsoft.carbonadvisor.carbon;

import com.microsoft.carbonadvisor.config.CarbonAdvisorProperties;
import com.microsoft.carbonadvisor.data.GridZoneTable;
import com.microsoft.carbonadvisor.data.RegionMappingTable;
import com.microsoft.carbonadvisor.domain.model.CloudProvider;
import com.microsoft.carbonadvisor.domain.model.GridZone;
import com.microsoft.carbonadvisor.domain.model.RegionMapping;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Carbon intensity lookups over the static grid zone and region mapping tables.
 *
 * All intensities are gCO2eq/kWh rounded to whole grams. Every lookup returns empty on a
 * miss instead of throwing; unmapped regions are normal.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CarbonIntensityService {

    /** Zones below this are counted as low carbon. */
    public static final int LOW_CARBON_THRESHOLD = 100;

    /** Zones above this are counted as high carbon. */
    public static final int HIGH_CARBON_THRESHOLD = 400;

    private static final String UNKNOWN_LOCATION = "Unknown";

    private final GridZoneTable gridZones;
    private final RegionMappingTable regionMappings;
    private final CarbonAdvisorProperties properties;

    public Optional<Integer> getCarbonIntensityByGridZone(String zoneKey) {
        return gridZones.find(zoneKey).map(GridZone::roundedIntensity);
    }

    public Optional<GridZone> getGridZoneInfo(String zoneKey) {
        return gridZones.find(zoneKey);
    }

    /**
     * Intensity for an ISO 3166-1 alpha-2 country code, ignoring case.
     *
     * Uses the national zone when the dataset has one, otherwise the mean of the country's
     * sub-national zones (NO-NO1 ... NO-NO5 for Norway).
     */
    public Optional<Integer> getCarbonIntensityByCountry(String countryCode) {
        if (countryCode == null || countryCode.isBlank()) {
            return Optional.empty();
        }
        String code = countryCode.trim().toUpperCase(Locale.ROOT);
        Optional<Integer> national = getCarbonIntensityByGridZone(code);
        if (national.isPresent()) {
            return national;
        }
        String prefix = code + "-";
        var subZones = gridZones.all().stream()
                .filter(zone -> zone.zoneKey().startsWith(prefix))
                .mapToDouble(GridZone::averageCo2)
                .summaryStatistics();
        if (subZones.getCount() == 0) {
            return Optional.empty();
        }
        return Optional.of((int) Math.round(subZones.getAverage()));
    }

    public Optional<Integer> getCarbonIntensityByProviderRegion(CloudProvider provider, String region) {
        return regionMappings.find(provider, region)
                .flatMap(mapping -> getCarbonIntensityByGridZone(mapping.gridZone()));
    }

    public Optional<Integer> getCarbonIntensityByProviderRegion(String providerId, String region) {
        return CloudProvider.fromId(providerId)
                .flatMap(provider -> getCarbonIntensityByProviderRegion(provider, region));
    }

    /**
     * Mapping and intensity for one provider region; empty unless both are known.
     */
    public Optional<RegionIntensity> resolveRegion(CloudProvider provider, String region) {
        return regionMappings.find(provider, region).flatMap(this::toRegionIntensity);
    }

    /**
     * Every region of the provider that has intensity data, lowest intensity first.
     * Regions with equal intensity keep their dataset order.
     */
    public List<RegionIntensity> getRegionsRankedByIntensity(CloudProvider provider) {
        return regionMappings.regionsFor(provider).stream()
                .map(this::toRegionIntensity)
                .flatMap(Optional::stream)
                .sorted(Comparator.comparingInt(RegionIntensity::intensity))
                .toList();
    }

    public List<RankedGridZone> getGridZonesRankedByCarbonIntensity() {
        return gridZones.all().stream()
                .sorted(Comparator.comparingDouble(GridZone::averageCo2))
                .map(zone -> new RankedGridZone(
                        zone.zoneKey(), zone.zoneName(), zone.country(), zone.roundedIntensity()))
                .toList();
    }

    public Map<CloudProvider, List<RegionIntensity>> getLowestCarbonRegionsByProvider() {
        return getLowestCarbonRegionsByProvider(properties.getRecommendations().getLowestRegionsLimit());
    }

    /**
     * The {@code limit} lowest-intensity regions of every provider in the mapping table.
     */
    public Map<CloudProvider, List<RegionIntensity>> getLowestCarbonRegionsByProvider(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        Map<CloudProvider, List<RegionIntensity>> result = new EnumMap<>(CloudProvider.class);
        for (CloudProvider provider : regionMappings.providers()) {
            List<RegionIntensity> ranked = getRegionsRankedByIntensity(provider);
            result.put(provider, ranked.subList(0, Math.min(limit, ranked.size())));
        }
        return result;
    }

    /**
     * One comparison row per query, in query order. Unknown providers or regions produce a
     * row with null zone and intensity and an "Unknown" location.
     */
    public List<RegionComparison> compareRegions(List<RegionQuery> queries) {
        List<RegionComparison> comparisons = new ArrayList<>(queries.size());
        for (RegionQuery query : queries) {
            Optional<RegionMapping> mapping = CloudProvider.fromId(query.provider())
                    .flatMap(provider -> regionMappings.find(provider, query.region()));
            comparisons.add(new RegionComparison(
                    query.provider(),
                    query.region(),
                    mapping.map(RegionMapping::gridZone).orElse(null),
                    mapping.flatMap(m -> getCarbonIntensityByGridZone(m.gridZone())).orElse(null),
                    mapping.map(RegionMapping::location).orElse(UNKNOWN_LOCATION)
            ));
        }
        return comparisons;
    }

    public GridDataStatistics getDataStatistics() {
        if (gridZones.isEmpty()) {
            return new GridDataStatistics(0, 0, 0, 0, 0, null, null);
        }

        int low = 0;
        int medium = 0;
        int high = 0;
        double sum = 0;
        GridZone lowest = null;
        GridZone highest = null;

        for (GridZone zone : gridZones.all()) {
            int intensity = zone.roundedIntensity();
            if (intensity < LOW_CARBON_THRESHOLD) {
                low++;
            } else if (intensity <= HIGH_CARBON_THRESHOLD) {
                medium++;
            } else {
                high++;
            }
            sum += zone.averageCo2();
            if (lowest == null || zone.averageCo2() < lowest.averageCo2()) {
                lowest = zone;
            }
            if (highest == null || zone.averageCo2() > highest.averageCo2()) {
                highest = zone;
            }
        }

        return new GridDataStatistics(
                gridZones.size(),
                low,
                medium,
                high,
                (int) Math.round(sum / gridZones.size()),
                new ZoneIntensity(lowest.zoneKey(), lowest.roundedIntensity()),
                new ZoneIntensity(highest.zoneKey(), highest.roundedIntensity())
        );
    }

    public static boolean isHighCarbon(Integer intensity) {
        return intensity != null && intensity > HIGH_CARBON_THRESHOLD;
    }

    private Optional<RegionIntensity> toRegionIntensity(RegionMapping mapping) {
        return gridZones.find(mapping.gridZone())
                .map(zone -> new RegionIntensity(
                        CloudProvider.fromId(mapping.provider()).orElse(null),
                        mapping.region(),
                        mapping.gridZone(),
                        mapping.location(),
                        mapping.country(),
                        mapping.notes(),
                        zone.roundedIntensity()
                ));
    }

    /**
     * A provider region together with its grid zone intensity.
     */
    public record RegionIntensity(
            CloudProvider provider,
            String region,
            String gridZone,
            String location,
            String country,
            String notes,
            int intensity
    ) {}

    public record RankedGridZone(
            String zoneKey,
            String zoneName,
            String country,
            int intensity
    ) {}

    public record RegionQuery(String provider, String region) {}

    public record RegionComparison(
            String provider,
            String region,
            String gridZone,
            Integer intensity,
            String location
    ) {}

    public record ZoneIntensity(String zoneKey, int intensity) {}

    /**
     * Descriptive statistics over the grid zone dataset. Bands: low below 100, medium 100 to 400,
     * high above 400 gCO2eq/kWh.
     */
    public record GridDataStatistics(
            int totalZones,
            int lowCarbonZones,
            int mediumCarbonZones,
            int highCarbonZones,
            int averageIntensity,
            ZoneIntensity lowestIntensity,
            ZoneIntensity highestIntensity
    ) {}
}
