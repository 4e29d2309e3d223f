package com.microsoft.carbonadvisor.scanner.parsers;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * AWS region code shape and region to ISO country lookup, shared by the AWS and CI parsers.
 */
final class AwsRegions {

    /** e.g. eu-north-1, ap-southeast-2, us-gov-west-1 */
    static final String REGION_SHAPE = "[a-z]{2}(?:-gov)?-[a-z]+-\\d+";

    private static final Pattern REGION = Pattern.compile(REGION_SHAPE);

    private static final Map<String, String> COUNTRIES = Map.ofEntries(
            Map.entry("us-east-1", "US"),
            Map.entry("us-east-2", "US"),
            Map.entry("us-west-1", "US"),
            Map.entry("us-west-2", "US"),
            Map.entry("ca-central-1", "CA"),
            Map.entry("ca-west-1", "CA"),
            Map.entry("sa-east-1", "BR"),
            Map.entry("eu-north-1", "SE"),
            Map.entry("eu-west-1", "IE"),
            Map.entry("eu-west-2", "GB"),
            Map.entry("eu-west-3", "FR"),
            Map.entry("eu-central-1", "DE"),
            Map.entry("eu-central-2", "CH"),
            Map.entry("eu-south-1", "IT"),
            Map.entry("eu-south-2", "ES"),
            Map.entry("ap-east-1", "HK"),
            Map.entry("ap-east-2", "TW"),
            Map.entry("ap-south-1", "IN"),
            Map.entry("ap-south-2", "IN"),
            Map.entry("ap-northeast-1", "JP"),
            Map.entry("ap-northeast-2", "KR"),
            Map.entry("ap-northeast-3", "JP"),
            Map.entry("ap-southeast-1", "SG"),
            Map.entry("ap-southeast-2", "AU"),
            Map.entry("ap-southeast-3", "ID"),
            Map.entry("ap-southeast-4", "AU"),
            Map.entry("ap-southeast-5", "MY"),
            Map.entry("ap-southeast-6", "NZ"),
            Map.entry("ap-southeast-7", "TH"),
            Map.entry("me-south-1", "BH"),
            Map.entry("me-central-1", "AE"),
            Map.entry("il-central-1", "IL"),
            Map.entry("af-south-1", "ZA"),
            Map.entry("mx-central-1", "MX"),
            Map.entry("us-gov-west-1", "US"),
            Map.entry("us-gov-east-1", "US"),
            Map.entry("cn-north-1", "CN"),
            Map.entry("cn-northwest-1", "CN")
    );

    private AwsRegions() {
    }

    static boolean isRegionCode(String value) {
        return value != null && REGION.matcher(value).matches();
    }

    static String countryOf(String region) {
        return region != null ? COUNTRIES.get(region) : null;
    }
}
