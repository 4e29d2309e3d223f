package com.microsoft.carbonadvisor.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Deployment targets recognised by the config parsers and the region mapping table.
 *
 * Each provider names its regions in its own native format (us-east-1, europe-north1,
 * westeurope, iad1, ...). Region lookups are always made in that native format.
 */
public enum CloudProvider {
    AWS("aws", "Amazon Web Services"),
    GCP("gcp", "Google Cloud Platform"),
    AZURE("azure", "Microsoft Azure"),
    VERCEL("vercel", "Vercel"),
    HEROKU("heroku", "Heroku"),
    NETLIFY("netlify", "Netlify");

    private final String id;
    private final String displayName;

    CloudProvider(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolve a provider from its id, ignoring case. Unknown or blank ids resolve to empty.
     */
    public static Optional<CloudProvider> fromId(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (CloudProvider provider : values()) {
            if (provider.id.equals(normalized)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }
}
