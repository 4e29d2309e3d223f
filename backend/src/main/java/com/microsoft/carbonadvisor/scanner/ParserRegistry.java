package com.microsoft.carbonadvisor.scanner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.carbonadvisor.scanner.parsers.AwsConfigParser;
import com.microsoft.carbonadvisor.scanner.parsers.AzureTerraformParser;
import com.microsoft.carbonadvisor.scanner.parsers.ConfigParser;
import com.microsoft.carbonadvisor.scanner.parsers.GcpTerraformParser;
import com.microsoft.carbonadvisor.scanner.parsers.GitHubActionsParser;
import com.microsoft.carbonadvisor.scanner.parsers.HerokuParser;
import com.microsoft.carbonadvisor.scanner.parsers.NetlifyParser;
import com.microsoft.carbonadvisor.scanner.parsers.VercelParser;

import java.util.List;
import java.util.Optional;

/**
 * Fixed set of config parsers with their globs compiled once.
 *
 * The set is composed explicitly at construction; there is no runtime registration.
 */
public final class ParserRegistry {

    private final List<RegisteredParser> entries;

    public ParserRegistry(List<? extends ConfigParser> parsers) {
        this.entries = parsers.stream()
                .map(parser -> new RegisteredParser(
                        parser,
                        parser.patterns().stream().map(GlobPattern::compile).toList()))
                .toList();
    }

    /**
     * The built-in parsers, in the order they run against each file.
     */
    public static ParserRegistry defaults(ObjectMapper objectMapper) {
        return new ParserRegistry(List.of(
                new AwsConfigParser(),
                new GcpTerraformParser(),
                new AzureTerraformParser(),
                new GitHubActionsParser(),
                new VercelParser(objectMapper),
                new HerokuParser(),
                new NetlifyParser()
        ));
    }

    public List<ConfigParser> parsers() {
        return entries.stream().map(RegisteredParser::parser).toList();
    }

    /**
     * Parsers with at least one glob matching the relative path, in registry order.
     */
    public List<ConfigParser> parsersFor(String relativePath) {
        return entries.stream()
                .filter(entry -> entry.matches(relativePath))
                .map(RegisteredParser::parser)
                .toList();
    }

    public Optional<ConfigParser> find(String name) {
        return entries.stream()
                .map(RegisteredParser::parser)
                .filter(parser -> parser.name().equals(name))
                .findFirst();
    }

    private record RegisteredParser(ConfigParser parser, List<GlobPattern> globs) {
        boolean matches(String relativePath) {
            for (GlobPattern glob : globs) {
                if (glob.matches(relativePath)) {
                    return true;
                }
            }
            return false;
        }
    }
}
