package com.microsoft.carbonadvisor.scanner.parsers;

import com.microsoft.carbonadvisor.domain.model.CloudProvider;
import com.microsoft.carbonadvisor.domain.model.DeploymentCandidate;
import com.microsoft.carbonadvisor.domain.model.DeploymentEnvironment;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Detects Netlify sites. Netlify serves from a global edge network, so no single region or
 * country applies and both stay null.
 */
public final class NetlifyParser implements ConfigParser {

    static final String CDN_NOTE = "Netlify uses a global CDN";

    @Override
    public String name() {
        return "netlify";
    }

    @Override
    public List<String> patterns() {
        return List.of("**/netlify.toml");
    }

    @Override
    public List<DeploymentCandidate> parse(Path file, String content) {
        if (!content.contains("[build]") && !content.contains("netlify")) {
            return List.of();
        }
        return List.of(DeploymentCandidate.builder()
                .name("Netlify CDN")
                .environment(DeploymentEnvironment.PRODUCTION)
                .provider(CloudProvider.NETLIFY)
                .configFilePath(file.toString())
                .configType("netlify")
                .metadata(Map.of("note", CDN_NOTE))
                .build());
    }
}
