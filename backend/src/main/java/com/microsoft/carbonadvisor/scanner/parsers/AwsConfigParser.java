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
 * Detects AWS regions in Terraform files and in CloudFormation, SAM, Elastic Beanstalk and
 * aws-config YAML files.
 *
 * Terraform: every {@code region = "..."} assignment whose value is an AWS region code.
 * YAML: every {@code Region:} key (also {@code region:} and {@code default_region:}) with an
 * AWS region code value.
 *
 * Unlike plain token extraction, Terraform {@code region} values that do not have the AWS region
 * shape ({@code eu-north-1}, {@code us-gov-west-1}) are dropped rather than reported as AWS. Google
 * Terraform shares the {@code region = "..."} syntax and the same {@code .tf} files, so without the
 * filter every GCP region would also surface as an unmapped AWS detection. Those regions are still
 * reported, once, by {@link GcpTerraformParser}.
 */
public final class AwsConfigParser implements ConfigParser {

    private static final List<String> PATTERNS = List.of(
            "**/*.tf",
            "**/aws-config.yaml",
            "**/.elasticbeanstalk/config.yml",
            "**/template.yaml",
            "**/template.yml"
    );

    private static final Pattern TERRAFORM_REGION =
            Pattern.compile("region\\s*=\\s*[\"']([^\"']+)[\"']");

    private static final Pattern TEMPLATE_REGION =
            Pattern.compile("[Rr]egion\\s*:\\s*[\"']?(" + AwsRegions.REGION_SHAPE + ")(?![\\w-])");

    @Override
    public String name() {
        return "aws";
    }

    @Override
    public List<String> patterns() {
        return PATTERNS;
    }

    @Override
    public List<DeploymentCandidate> parse(Path file, String content) {
        String fileName = file.getFileName() != null ? file.getFileName().toString() : "";
        if (fileName.endsWith(".tf")) {
            return parseTerraform(file, content);
        }
        if (fileName.endsWith(".yaml") || fileName.endsWith(".yml")) {
            return parseTemplate(file, content, templateType(file));
        }
        return List.of();
    }

    private List<DeploymentCandidate> parseTerraform(Path file, String content) {
        List<DeploymentCandidate> results = new ArrayList<>();
        DeploymentEnvironment environment = EnvironmentInference.fromPathAndContent(file, content);
        Matcher matcher = TERRAFORM_REGION.matcher(content);
        while (matcher.find()) {
            String region = matcher.group(1);
            // google/azure regions share the assignment syntax
            if (!AwsRegions.isRegionCode(region)) {
                continue;
            }
            results.add(candidate(file, region, environment, "terraform", Map.of("raw_region", region)));
        }
        return results;
    }

    private List<DeploymentCandidate> parseTemplate(Path file, String content, String configType) {
        List<DeploymentCandidate> results = new ArrayList<>();
        DeploymentEnvironment environment = EnvironmentInference.fromPathAndContent(file, content);
        Matcher matcher = TEMPLATE_REGION.matcher(content);
        while (matcher.find()) {
            results.add(candidate(file, matcher.group(1), environment, configType, Map.of()));
        }
        return results;
    }

    private DeploymentCandidate candidate(Path file,
                                          String region,
                                          DeploymentEnvironment environment,
                                          String configType,
                                          Map<String, Object> metadata) {
        return DeploymentCandidate.builder()
                .name("AWS " + region)
                .environment(environment)
                .provider(CloudProvider.AWS)
                .region(region)
                .country(AwsRegions.countryOf(region))
                .configFilePath(file.toString())
                .configType(configType)
                .metadata(metadata)
                .build();
    }

    private static String templateType(Path file) {
        String fileName = file.getFileName().toString();
        Path parent = file.getParent();
        if (parent != null && parent.getFileName() != null
                && ".elasticbeanstalk".equals(parent.getFileName().toString())) {
            return "elastic-beanstalk";
        }
        if ("aws-config.yaml".equals(fileName)) {
            return "aws-config";
        }
        return "cloudformation";
    }
}
