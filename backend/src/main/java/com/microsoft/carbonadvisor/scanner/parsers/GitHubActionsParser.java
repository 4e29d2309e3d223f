package com.microsoft.carbonadvisor.scanner.parsers;

import com.microsoft.carbonadvisor.domain.model.CloudProvider;
import com.microsoft.carbonadvisor.domain.model.DeploymentCandidate;
import com.microsoft.carbonadvisor.domain.model.DeploymentEnvironment;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects AWS deploy targets in GitHub Actions workflows from the {@code AWS_REGION} or
 * {@code AWS_DEFAULT_REGION} environment variable. Workflows are assumed to deploy production.
 */
public final class GitHubActionsParser implements ConfigParser {

    private static final List<String> PATTERNS = List.of(
            "**/.github/workflows/*.yml",
            "**/.github/workflows/*.yaml"
    );

    private static final Pattern AWS_REGION_VARIABLE = Pattern.compile(
            "AWS_(?:DEFAULT_)?REGION\\s*:\\s*[\"']?(" + AwsRegions.REGION_SHAPE + ")(?![\\w-])");

    @Override
    public String name() {
        return "github-actions";
    }

    @Override
    public List<String> patterns() {
        return PATTERNS;
    }

    @Override
    public List<DeploymentCandidate> parse(Path file, String content) {
        List<DeploymentCandidate> results = new ArrayList<>();
        Matcher matcher = AWS_REGION_VARIABLE.matcher(content);
        while (matcher.find()) {
            String region = matcher.group(1);
            results.add(DeploymentCandidate.builder()
                    .name("AWS " + region + " (CI/CD)")
                    .environment(DeploymentEnvironment.PRODUCTION)
                    .provider(CloudProvider.AWS)
                    .region(region)
                    .country(AwsRegions.countryOf(region))
                    .configFilePath(file.toString())
                    .configType("github-actions")
                    .build());
        }
        return results;
    }
}
