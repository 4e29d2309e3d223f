package com.microsoft.carbonadvisor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.carbonadvisor.data.CarbonDatasetLoader;
import com.microsoft.carbonadvisor.data.GridZoneTable;
import com.microsoft.carbonadvisor.data.RegionMappingTable;
import com.microsoft.carbonadvisor.scanner.ParserRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the static carbon tables and the parser registry.
 *
 * Both tables are loaded once here and injected as read-only beans; tests build their
 * own fixture tables instead of going through this class.
 */
@Configuration
public class CarbonDataConfig {

    @Bean
    public GridZoneTable gridZoneTable(CarbonDatasetLoader loader, CarbonAdvisorProperties properties) {
        return loader.loadGridZones(properties.getDatasets().getGridZones());
    }

    @Bean
    public RegionMappingTable regionMappingTable(CarbonDatasetLoader loader, CarbonAdvisorProperties properties) {
        return loader.loadRegionMappings(properties.getDatasets().getRegionMappings());
    }

    @Bean
    public ParserRegistry parserRegistry(ObjectMapper objectMapper) {
        return ParserRegistry.defaults(objectMapper);
    }
}
