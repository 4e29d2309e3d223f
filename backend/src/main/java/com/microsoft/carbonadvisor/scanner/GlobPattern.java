package com.microsoft.carbonadvisor.scanner;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A file glob compiled to an anchored regular expression.
 *
 * <ul>
 *   <li>{@code **} matches zero or more path segments; a leading {@code **}{@code /} is optional,
 *       so {@code **}{@code /main.tf} also matches a root-level {@code main.tf}</li>
 *   <li>{@code *} matches any run of characters except {@code /}</li>
 *   <li>{@code ?} matches exactly one character except {@code /}</li>
 *   <li>every other character is literal</li>
 * </ul>
 *
 * Paths are matched relative to the scan root with {@code /} as separator.
 */
public final class GlobPattern {

    private static final String REGEX_SPECIALS = "\\.[]{}()<>+-=!^$|&#~";

    private final String glob;
    private final Pattern pattern;

    private GlobPattern(String glob, Pattern pattern) {
        this.glob = glob;
        this.pattern = pattern;
    }

    public static GlobPattern compile(String glob) {
        Objects.requireNonNull(glob, "glob");
        return new GlobPattern(glob, Pattern.compile(toRegex(glob)));
    }

    public boolean matches(String relativePath) {
        if (relativePath == null) {
            return false;
        }
        return pattern.matcher(relativePath.replace('\\', '/')).matches();
    }

    public String glob() {
        return glob;
    }

    public Pattern pattern() {
        return pattern;
    }

    static String toRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() * 2);
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*' && i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                boolean segmentStart = i == 0 || glob.charAt(i - 1) == '/';
                boolean followedBySlash = i + 2 < glob.length() && glob.charAt(i + 2) == '/';
                if (segmentStart && followedBySlash) {
                    // "**/" spans zero or more whole directories
                    regex.append("(?:.*/)?");
                    i += 3;
                } else if (segmentStart && i + 2 == glob.length()) {
                    regex.append(".*");
                    i += 2;
                } else {
                    regex.append("[^/]*");
                    i += 2;
                }
                continue;
            }
            switch (c) {
                case '*' -> regex.append("[^/]*");
                case '?' -> regex.append("[^/]");
                default -> {
                    if (REGEX_SPECIALS.indexOf(c) >= 0) {
                        regex.append('\\');
                    }
                    regex.append(c);
                }
            }
            i++;
        }
        return regex.toString();
    }

    @Override
    public String toString() {
        return glob;
    }
}
