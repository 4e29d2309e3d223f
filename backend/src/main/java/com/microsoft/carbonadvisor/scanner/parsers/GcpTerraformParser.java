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
 * Detects Google Cloud regions in Terraform files.
 *
 * A {@code region = "..."} assignment only counts when a {@code provider "google"} block marker
 * precedes it; each marker yields at most one region.
 */
public final class GcpTerraformParser implements ConfigParser {

    private static final Pattern PROVIDER_REGION = Pattern.compile(
            "provider\\s+\"google(?:-beta)?\".*?region\\s*=\\s*[\"']([^\"']+)[\"']",
            Pattern.DOTALL);

    private static final Map<String, String> COUNTRIES = Map.ofEntries(
            Map.entry("us-east1", "US"),
            Map.entry("us-east4", "US"),
            Map.entry("us-east5", "US"),
            Map.entry("us-central1", "US"),
            Map.entry("us-south1", "US"),
            Map.entry("us-west1", "US"),
            Map.entry("us-west2", "US"),
            Map.entry("us-west3", "US"),
            Map.entry("us-west4", "US"),
            Map.entry("northamerica-northeast1", "CA"),
            Map.entry("northamerica-northeast2", "CA"),
            Map.entry("northamerica-south1", "MX"),
            Map.entry("southamerica-east1", "BR"),
            Map.entry("southamerica-west1", "CL"),
            Map.entry("europe-north1", "FI"),
            Map.entry("europe-north2", "SE"),
            Map.entry("europe-west1", "BE"),
            Map.entry("europe-west2", "GB"),
            Map.entry("europe-west3", "DE"),
            Map.entry("europe-west4", "NL"),
            Map.entry("europe-west6", "CH"),
            Map.entry("europe-west8", "IT"),
            Map.entry("europe-west9", "FR"),
            Map.entry("europe-west10", "DE"),
            Map.entry("europe-west12", "IT"),
            Map.entry("europe-central2", "PL"),
            Map.entry("europe-southwest1", "ES"),
            Map.entry("asia-east1", "TW"),
            Map.entry("asia-east2", "HK"),
            Map.entry("asia-northeast1", "JP"),
            Map.entry("asia-northeast2", "JP"),
            Map.entry("asia-northeast3", "KR"),
            Map.entry("asia-south1", "IN"),
            Map.entry("asia-south2", "IN"),
            Map.entry("asia-southeast1", "SG"),
            Map.entry("asia-southeast2", "ID"),
            Map.entry("australia-southeast1", "AU"),
            Map.entry("australia-southeast2", "AU"),
            Map.entry("me-central1", "QA"),
            Map.entry("me-central2", "SA"),
            Map.entry("me-west1", "IL"),
            Map.entry("africa-south1", "ZA")
    );

    @Override
    public String name() {
        return "gcp";
    }

    @Override
    public List<String> patterns() {
        return List.of("**/*.tf");
    }

    @Override
    public List<DeploymentCandidate> parse(Path file, String content) {
        List<DeploymentCandidate> results = new ArrayList<>();
        DeploymentEnvironment environment = EnvironmentInference.fromPath(file);
        Matcher matcher = PROVIDER_REGION.matcher(content);
        while (matcher.find()) {
            String region = matcher.group(1);
            results.add(DeploymentCandidate.builder()
                    .name("GCP " + region)
                    .environment(environment)
                    .provider(CloudProvider.GCP)
                    .region(region)
                    .country(COUNTRIES.get(region))
                    .configFilePath(file.toString())
                    .configType("terraform")
                    .build());
        }
        return results;
    }
}
