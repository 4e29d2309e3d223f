package com.microsoft.carbonadvisor.scanner.parsers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.carbonadvisor.domain.model.CloudProvider;
import com.microsoft.carbonadvisor.domain.model.DeploymentCandidate;
import com.microsoft.carbonadvisor.domain.model.DeploymentEnvironment;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the {@code regions} array of a Vercel project config.
 *
 * Projects without an explicit {@code regions} field run in Vercel's default region, iad1.
 * Invalid JSON yields no candidates.
 */
@Slf4j
public final class VercelParser implements ConfigParser {

    static final String DEFAULT_REGION = "iad1";

    private static final List<String> PATTERNS = List.of("**/vercel.json", "**/.vercel/project.json");

    private static final Map<String, String> COUNTRIES = Map.ofEntries(
            Map.entry("iad1", "US"),
            Map.entry("cle1", "US"),
            Map.entry("pdx1", "US"),
            Map.entry("sfo1", "US"),
            Map.entry("gru1", "BR"),
            Map.entry("arn1", "SE"),
            Map.entry("cdg1", "FR"),
            Map.entry("dub1", "IE"),
            Map.entry("fra1", "DE"),
            Map.entry("lhr1", "GB"),
            Map.entry("bom1", "IN"),
            Map.entry("hkg1", "HK"),
            Map.entry("hnd1", "JP"),
            Map.entry("kix1", "JP"),
            Map.entry("icn1", "KR"),
            Map.entry("sin1", "SG"),
            Map.entry("syd1", "AU"),
            Map.entry("dxb1", "AE"),
            Map.entry("cpt1", "ZA")
    );

    private final ObjectMapper objectMapper;

    public VercelParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "vercel";
    }

    @Override
    public List<String> patterns() {
        return PATTERNS;
    }

    @Override
    public List<DeploymentCandidate> parse(Path file, String content) {
        JsonNode config;
        try {
            config = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring {}: not valid JSON ({})", file, e.getOriginalMessage());
            return List.of();
        }
        if (config == null || !config.isObject()) {
            return List.of();
        }

        List<DeploymentCandidate> results = new ArrayList<>();
        for (String region : regions(config)) {
            results.add(DeploymentCandidate.builder()
                    .name("Vercel " + region)
                    .environment(DeploymentEnvironment.PRODUCTION)
                    .provider(CloudProvider.VERCEL)
                    .region(region)
                    .country(COUNTRIES.get(region))
                    .configFilePath(file.toString())
                    .configType("vercel")
                    .build());
        }
        return results;
    }

    private static List<String> regions(JsonNode config) {
        JsonNode regions = config.get("regions");
        if (regions == null || regions.isNull()) {
            return List.of(DEFAULT_REGION);
        }
        if (!regions.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode region : regions) {
            if (region.isTextual() && !region.asText().isBlank()) {
                values.add(region.asText());
            }
        }
        return values;
    }
}
