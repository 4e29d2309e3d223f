package com.microsoft.carbonadvisor.scanner.parsers;

import com.microsoft.carbonadvisor.domain.model.CloudProvider;
import com.microsoft.carbonadvisor.domain.model.DeploymentCandidate;
import com.microsoft.carbonadvisor.domain.model.DeploymentEnvironment;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects Azure locations in Terraform files.
 *
 * Every {@code location = "..."} assignment after the first {@code azurerm} marker is a candidate.
 * Locations are kept exactly as written, so display names such as "West Europe" will not map.
 */
public final class AzureTerraformParser implements ConfigParser {

    private static final String PROVIDER_MARKER = "azurerm";

    private static final Pattern LOCATION = Pattern.compile("location\\s*=\\s*[\"']([^\"']+)[\"']");

    private static final Map<String, String> COUNTRIES = Map.ofEntries(
            Map.entry("eastus", "US"),
            Map.entry("eastus2", "US"),
            Map.entry("centralus", "US"),
            Map.entry("northcentralus", "US"),
            Map.entry("southcentralus", "US"),
            Map.entry("westcentralus", "US"),
            Map.entry("westus", "US"),
            Map.entry("westus2", "US"),
            Map.entry("westus3", "US"),
            Map.entry("canadacentral", "CA"),
            Map.entry("canadaeast", "CA"),
            Map.entry("brazilsouth", "BR"),
            Map.entry("brazilsoutheast", "BR"),
            Map.entry("chilecentral", "CL"),
            Map.entry("mexicocentral", "MX"),
            Map.entry("northeurope", "IE"),
            Map.entry("westeurope", "NL"),
            Map.entry("uksouth", "GB"),
            Map.entry("ukwest", "GB"),
            Map.entry("francecentral", "FR"),
            Map.entry("francesouth", "FR"),
            Map.entry("germanywestcentral", "DE"),
            Map.entry("germanynorth", "DE"),
            Map.entry("switzerlandnorth", "CH"),
            Map.entry("switzerlandwest", "CH"),
            Map.entry("norwayeast", "NO"),
            Map.entry("norwaywest", "NO"),
            Map.entry("swedencentral", "SE"),
            Map.entry("polandcentral", "PL"),
            Map.entry("austriaeast", "AT"),
            Map.entry("belgiumcentral", "BE"),
            Map.entry("spaincentral", "ES"),
            Map.entry("italynorth", "IT"),
            Map.entry("eastasia", "HK"),
            Map.entry("southeastasia", "SG"),
            Map.entry("japaneast", "JP"),
            Map.entry("japanwest", "JP"),
            Map.entry("koreacentral", "KR"),
            Map.entry("koreasouth", "KR"),
            Map.entry("centralindia", "IN"),
            Map.entry("southindia", "IN"),
            Map.entry("westindia", "IN"),
            Map.entry("australiaeast", "AU"),
            Map.entry("australiasoutheast", "AU"),
            Map.entry("australiacentral", "AU"),
            Map.entry("australiacentral2", "AU"),
            Map.entry("indonesiacentral", "ID"),
            Map.entry("malaysiawest", "MY"),
            Map.entry("newzealandnorth", "NZ"),
            Map.entry("uaenorth", "AE"),
            Map.entry("uaecentral", "AE"),
            Map.entry("qatarcentral", "QA"),
            Map.entry("israelcentral", "IL"),
            Map.entry("southafricanorth", "ZA"),
            Map.entry("southafricawest", "ZA"),
            Map.entry("usgov-virginia", "US"),
            Map.entry("usgov-texas", "US"),
            Map.entry("usgov-arizona", "US"),
            Map.entry("usdod-central", "US"),
            Map.entry("usdod-east", "US"),
            Map.entry("chinaeast", "CN"),
            Map.entry("chinaeast2", "CN"),
            Map.entry("chinanorth", "CN"),
            Map.entry("chinanorth2", "CN"),
            Map.entry("chinanorth3", "CN")
    );

    @Override
    public String name() {
        return "azure";
    }

    @Override
    public List<String> patterns() {
        return List.of("**/*.tf");
    }

    @Override
    public List<DeploymentCandidate> parse(Path file, String content) {
        int markerIndex = content.indexOf(PROVIDER_MARKER);
        if (markerIndex < 0) {
            return List.of();
        }
        List<DeploymentCandidate> results = new ArrayList<>();
        DeploymentEnvironment environment = EnvironmentInference.fromPath(file);
        Matcher matcher = LOCATION.matcher(content);
        matcher.region(markerIndex, content.length());
        while (matcher.find()) {
            String location = matcher.group(1);
            results.add(DeploymentCandidate.builder()
                    .name("Azure " + location)
                    .environment(environment)
                    .provider(CloudProvider.AZURE)
                    .region(location)
                    .country(COUNTRIES.get(location))
                    .configFilePath(file.toString())
                    .configType("terraform")
                    .build());
        }
        return results;
    }
}
