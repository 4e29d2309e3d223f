package com.microsoft.carbonadvisor.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Strongly-typed binding for all {@code carbon-advisor.*} properties.
 *
 * <pre>
 * carbon-advisor:
 *   datasets:
 *     grid-zones:      classpath:data/grid-zones.json
 *     region-mappings: classpath:data/region-mappings.json
 *   scan:
 *     skip-directories: [.git, node_modules, target, ...]
 *   recommendations:
 *     lowest-regions-limit: 5
 *     daily-energy-kwh:     1.0
 *   startup-scan:
 *     path:       /path/to/project
 *     project-id: my-project
 * </pre>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "carbon-advisor")
public class CarbonAdvisorProperties {

    @Valid
    @NestedConfigurationProperty
    private Datasets datasets = new Datasets();

    @Valid
    @NestedConfigurationProperty
    private Scan scan = new Scan();

    @Valid
    @NestedConfigurationProperty
    private Recommendations recommendations = new Recommendations();

    @Valid
    @NestedConfigurationProperty
    private StartupScan startupScan = new StartupScan();

    @Data
    public static class Datasets {
        @NotBlank
        private String gridZones = "classpath:data/grid-zones.json";

        @NotBlank
        private String regionMappings = "classpath:data/region-mappings.json";
    }

    @Data
    public static class Scan {
        /** Directory names never descended into: VCS metadata, dependency caches, build output. */
        @NotNull
        private List<String> skipDirectories = new ArrayList<>(List.of(
                ".git", ".hg", ".svn",
                "node_modules", ".terraform", ".venv", "venv", "vendor", "__pycache__", ".gradle", ".m2",
                "target", "build", "dist", "out"
        ));
    }

    @Data
    public static class Recommendations {
        @Min(1)
        private int lowestRegionsLimit = 5;

        /** Assumed energy use per deployment per day, in kWh, for the annual savings estimate. */
        @Positive
        private double dailyEnergyKwh = 1.0;
    }

    @Data
    public static class StartupScan {
        /** Directory scanned once at startup; blank disables the startup scan. */
        private String path;

        /** When set, startup results are handed to the detection sink under this project id. */
        private String projectId;

        @NotBlank
        private String source = "startup-scan";
    }
}
