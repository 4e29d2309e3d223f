package com.microsoft.carbonadvisor.scanner.parsers;

import com.microsoft.carbonadvisor.domain.model.CloudProvider;
import com.microsoft.carbonadvisor.domain.model.DeploymentCandidate;
import com.microsoft.carbonadvisor.domain.model.DeploymentEnvironment;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Detects Heroku apps from heroku.yml, or from an app.json that mentions Heroku.
 *
 * Heroku config files do not name a region; it is only available from the Heroku Platform API,
 * which this parser does not call. Region and country are left null.
 */
public final class HerokuParser implements ConfigParser {

    static final String REGION_NOTE = "Region detection requires the Heroku Platform API";

    @Override
    public String name() {
        return "heroku";
    }

    @Override
    public List<String> patterns() {
        return List.of("**/heroku.yml", "**/app.json");
    }

    @Override
    public List<DeploymentCandidate> parse(Path file, String content) {
        boolean herokuManifest = file.getFileName() != null
                && "heroku.yml".equals(file.getFileName().toString());
        if (!herokuManifest && !content.toLowerCase(Locale.ROOT).contains("heroku")) {
            return List.of();
        }
        return List.of(DeploymentCandidate.builder()
                .name("Heroku App")
                .environment(DeploymentEnvironment.PRODUCTION)
                .provider(CloudProvider.HEROKU)
                .configFilePath(file.toString())
                .configType("heroku")
                .metadata(Map.of("note", REGION_NOTE))
                .build());
    }
}
