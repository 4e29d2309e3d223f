package com.microsoft.carbonadvisor.scanner.parsers;

import com.microsoft.carbonadvisor.domain.model.DeploymentEnvironment;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Keyword-based environment guesses shared by the parsers.
 *
 * Only the file name and its parent directory are inspected, never the scan root's
 * own location on disk.
 */
final class EnvironmentInference {

    private EnvironmentInference() {
    }

    static DeploymentEnvironment fromPath(Path file) {
        return fromPathAndContent(file, null);
    }

    static DeploymentEnvironment fromPathAndContent(Path file, String content) {
        String path = localPath(file);
        String text = content != null ? content.toLowerCase(Locale.ROOT) : "";

        if (path.contains("prod") || text.contains("production")) {
            return DeploymentEnvironment.PRODUCTION;
        }
        if (path.contains("staging") || text.contains("staging")) {
            return DeploymentEnvironment.STAGING;
        }
        if (path.contains("dev") || text.contains("development")) {
            return DeploymentEnvironment.DEVELOPMENT;
        }
        return DeploymentEnvironment.UNKNOWN;
    }

    private static String localPath(Path file) {
        if (file == null || file.getFileName() == null) {
            return "";
        }
        Path parent = file.getParent();
        String name = file.getFileName().toString();
        if (parent != null && parent.getFileName() != null) {
            name = parent.getFileName() + "/" + name;
        }
        return name.toLowerCase(Locale.ROOT);
    }
}
