package com.microsoft.carbonadvisor.scanner.parsers;

import com.microsoft.carbonadvisor.domain.model.DeploymentCandidate;

import java.nio.file.Path;
import java.util.List;

/**
 * Extracts deployment candidates from one family of configuration files.
 *
 * Each implementation handles a specific provider or config format and declares the
 * file globs it wants to see. Parsers only do pattern extraction; they never resolve
 * grid zones or talk to provider APIs.
 */
public interface ConfigParser {

    /**
     * Short identifier used in logs, e.g. "aws" or "github-actions".
     */
    String name();

    /**
     * Globs matched against paths relative to the scan root.
     */
    List<String> patterns();

    /**
     * Parse one file.
     *
     * @param file absolute path of the matched file
     * @param content UTF-8 file content
     * @return zero or more candidates; never null
     */
    List<DeploymentCandidate> parse(Path file, String content);
}
