package com.microsoft.carbonadvisor.scanner;

import com.microsoft.carbonadvisor.config.CarbonAdvisorProperties;
import com.microsoft.carbonadvisor.domain.model.DeploymentCandidate;
import com.microsoft.carbonadvisor.domain.model.EnrichedDeployment;
import com.microsoft.carbonadvisor.enrichment.DeploymentEnricher;
import com.microsoft.carbonadvisor.scanner.parsers.ConfigParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Walks a source tree, runs every matching config parser on each file and enriches the
 * resulting candidates.
 *
 * SCAN FLOW:
 * 1. Iterative walk from the root with an explicit stack, skipping configured directory names
 *    and never following directory symlinks
 * 2. Each file's path relative to the root is tested against every parser's globs
 * 3. Matching files are read once as UTF-8, with malformed bytes replaced, and handed to each
 *    matching parser
 * 4. All candidates go through enrichment
 *
 * Result order follows the filesystem walk and is not stable. Detections of the same file by
 * different parsers are all kept.
 *
 * FAILURE ISOLATION:
 * An unreadable directory or file, or a parser throwing, is logged and skipped; the scan
 * always completes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeploymentScanner {

    private final ParserRegistry parserRegistry;
    private final DeploymentEnricher enricher;
    private final CarbonAdvisorProperties properties;

    public List<EnrichedDeployment> scanDirectory(Path root) {
        List<DeploymentCandidate> candidates = collectCandidates(root);
        List<EnrichedDeployment> enriched = candidates.stream()
                .map(enricher::enrich)
                .toList();
        log.info("Scan of {} found {} deployment candidates", root, enriched.size());
        return enriched;
    }

    /**
     * Raw parser output for the tree, before enrichment.
     */
    public List<DeploymentCandidate> collectCandidates(Path root) {
        Objects.requireNonNull(root, "root");
        if (!Files.isDirectory(root)) {
            log.warn("Scan root {} is not a readable directory", root);
            return List.of();
        }

        Set<String> skipDirectories = Set.copyOf(properties.getScan().getSkipDirectories());
        List<DeploymentCandidate> candidates = new ArrayList<>();
        Deque<Path> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            Path directory = stack.pop();
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
                for (Path entry : entries) {
                    if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                        if (!skipDirectories.contains(entry.getFileName().toString())) {
                            stack.push(entry);
                        }
                    } else if (Files.isRegularFile(entry)) {
                        candidates.addAll(scanFile(root, entry));
                    }
                }
            } catch (IOException | DirectoryIteratorException e) {
                log.warn("Skipping unreadable directory {}: {}", directory, e.getMessage());
            }
        }
        return candidates;
    }

    private List<DeploymentCandidate> scanFile(Path root, Path file) {
        List<ConfigParser> parsers = parserRegistry.parsersFor(relativePath(root, file));
        if (parsers.isEmpty()) {
            return List.of();
        }

        String content;
        try {
            // malformed bytes decode to U+FFFD instead of failing the whole file
            content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Skipping unreadable file {}: {}", file, e.getMessage());
            return List.of();
        }

        List<DeploymentCandidate> found = new ArrayList<>();
        for (ConfigParser parser : parsers) {
            try {
                List<DeploymentCandidate> detections = parser.parse(file, content);
                log.debug("Parser {} found {} candidates in {}", parser.name(), detections.size(), file);
                found.addAll(detections);
            } catch (RuntimeException e) {
                log.warn("Parser {} failed on {}, skipping file", parser.name(), file, e);
            }
        }
        return found;
    }

    static String relativePath(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
