package com.microsoft.carbonadvisor.data;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.carbonadvisor.domain.model.GridZone;
import com.microsoft.carbonadvisor.domain.model.RegionMapping;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads the bundled JSON datasets into static tables.
 *
 * A dataset that cannot be read or parsed is logged and yields an empty table; the
 * application still starts and every lookup against that table degrades to a miss.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CarbonDatasetLoader {

    private static final TypeReference<List<GridZone>> GRID_ZONES = new TypeReference<>() {};
    private static final TypeReference<List<RegionMapping>> REGION_MAPPINGS = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public GridZoneTable loadGridZones(String location) {
        List<GridZone> zones = readRecords(location, GRID_ZONES);
        GridZoneTable table = new GridZoneTable(zones);
        log.info("Loaded {} grid zones from {}", table.size(), location);
        return table;
    }

    public RegionMappingTable loadRegionMappings(String location) {
        List<RegionMapping> mappings = readRecords(location, REGION_MAPPINGS);
        RegionMappingTable table = new RegionMappingTable(mappings);
        log.info("Loaded {} region mappings for {} providers from {}",
                table.size(), table.providers().size(), location);
        return table;
    }

    private <T> List<T> readRecords(String location, TypeReference<List<T>> type) {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            List<T> records = objectMapper.readValue(in, type);
            return records != null ? records : List.of();
        } catch (IOException e) {
            log.error("Failed to load dataset from {}, continuing with an empty table", location, e);
            return List.of();
        }
    }
}
