package com.microsoft.carbonadvisor.data;

import com.microsoft.carbonadvisor.domain.model.CloudProvider;
import com.microsoft.carbonadvisor.domain.model.RegionMapping;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only (provider, native region code) to grid zone mapping.
 *
 * Region codes are matched exactly in the provider's own format; "eu-north-1" and
 * "EU-NORTH-1" are different keys. Per-provider iteration order is dataset order.
 */
@Slf4j
public final class RegionMappingTable {

    private final Map<CloudProvider, Map<String, RegionMapping>> byProvider;

    public RegionMappingTable(Collection<RegionMapping> source) {
        Map<CloudProvider, Map<String, RegionMapping>> grouped = new EnumMap<>(CloudProvider.class);
        for (RegionMapping mapping : source) {
            if (mapping == null || mapping.region() == null || mapping.gridZone() == null) {
                log.warn("Skipping incomplete region mapping: {}", mapping);
                continue;
            }
            Optional<CloudProvider> provider = CloudProvider.fromId(mapping.provider());
            if (provider.isEmpty()) {
                log.warn("Skipping region mapping {} for unknown provider '{}'", mapping.region(), mapping.provider());
                continue;
            }
            Map<String, RegionMapping> regions = grouped.computeIfAbsent(provider.get(), p -> new LinkedHashMap<>());
            if (regions.putIfAbsent(mapping.region(), mapping) != null) {
                log.warn("Duplicate region mapping {}/{} ignored", mapping.provider(), mapping.region());
            }
        }
        grouped.replaceAll((provider, regions) -> Collections.unmodifiableMap(regions));
        this.byProvider = Collections.unmodifiableMap(grouped);
    }

    public static RegionMappingTable empty() {
        return new RegionMappingTable(List.of());
    }

    public Optional<RegionMapping> find(CloudProvider provider, String region) {
        if (provider == null || region == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byProvider.getOrDefault(provider, Map.of()).get(region));
    }

    /**
     * Every region registered for the provider, in dataset order.
     */
    public List<RegionMapping> regionsFor(CloudProvider provider) {
        if (provider == null) {
            return List.of();
        }
        return List.copyOf(byProvider.getOrDefault(provider, Map.of()).values());
    }

    public Set<CloudProvider> providers() {
        return byProvider.keySet();
    }

    public int size() {
        return byProvider.values().stream().mapToInt(Map::size).sum();
    }

    public boolean isEmpty() {
        return byProvider.isEmpty();
    }
}
