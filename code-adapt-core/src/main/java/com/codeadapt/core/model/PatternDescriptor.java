package com.codeadapt.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * A stylistic pattern a component currently exhibits.
 *
 * @param type pattern kind
 * @param current current value in the vocabulary of the pattern kind, e.g. {@code camelCase}
 * @param description human-readable description
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PatternDescriptor(
    PatternType type,
    String current,
    String description
) {
    public PatternDescriptor {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(current, "current must not be null");
        if (description == null) {
            description = "";
        }
    }
}
