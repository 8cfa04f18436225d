package com.codeadapt.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * A named place in a component where additional statements may be spliced.
 *
 * <p>The location is resolved against a freshly parsed tree at adaptation time. Supported
 * forms are {@code function:NAME}, {@code function:NAME:start}, {@code function:NAME:end},
 * the same three for {@code method:}, and {@code comment:MARKER}.
 *
 * @param id identifier referenced by inject directives
 * @param description human-readable description
 * @param kind default placement for directives that do not name one
 * @param location location expression
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InjectionPoint(
    String id,
    String description,
    InjectionPosition kind,
    String location
) {
    public InjectionPoint {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(location, "location must not be null");
        if (kind == null) {
            kind = InjectionPosition.BEFORE;
        }
        if (description == null) {
            description = "";
        }
    }
}
