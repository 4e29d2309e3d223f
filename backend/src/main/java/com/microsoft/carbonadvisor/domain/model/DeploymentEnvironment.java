package com.microsoft.carbonadvisor.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Environment a detected deployment serves, inferred from file names and content keywords.
 */
public enum DeploymentEnvironment {
    PRODUCTION("production"),
    STAGING("staging"),
    DEVELOPMENT("development"),
    UNKNOWN("unknown");

    private final String id;

    DeploymentEnvironment(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }
}
