package com.microsoft.carbonadvisor.data;

import com.microsoft.carbonadvisor.domain.model.GridZone;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only grid zone dataset keyed by zone key.
 *
 * Built once from the bundled dataset (or a test fixture) and never mutated afterwards, so a
 * single instance can be shared by concurrent scans.
 */
@Slf4j
public final class GridZoneTable {

    private final Map<String, GridZone> zones;

    public GridZoneTable(Collection<GridZone> source) {
        Map<String, GridZone> byKey = new LinkedHashMap<>();
        for (GridZone zone : source) {
            if (zone == null || zone.zoneKey() == null || zone.zoneKey().isBlank()) {
                log.warn("Skipping grid zone without a zone key: {}", zone);
                continue;
            }
            if (zone.averageCo2() < 0 || Double.isNaN(zone.averageCo2())) {
                log.warn("Skipping grid zone {} with invalid average intensity {}", zone.zoneKey(), zone.averageCo2());
                continue;
            }
            if (byKey.putIfAbsent(zone.zoneKey(), zone) != null) {
                log.warn("Duplicate grid zone {} ignored, keeping first entry", zone.zoneKey());
            }
        }
        this.zones = Collections.unmodifiableMap(byKey);
    }

    public static GridZoneTable empty() {
        return new GridZoneTable(List.of());
    }

    /**
     * Exact, case-sensitive lookup.
     */
    public Optional<GridZone> find(String zoneKey) {
        if (zoneKey == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(zones.get(zoneKey));
    }

    /**
     * All zones in dataset order.
     */
    public Collection<GridZone> all() {
        return zones.values();
    }

    public int size() {
        return zones.size();
    }

    public boolean isEmpty() {
        return zones.isEmpty();
    }
}
