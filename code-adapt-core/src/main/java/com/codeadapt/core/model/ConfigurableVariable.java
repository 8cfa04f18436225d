package com.codeadapt.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * A value of a component that consumers may override.
 *
 * @param name variable name (property key, or environment variable name for {@link VariableType#ENV})
 * @param type value type
 * @param description human-readable description
 * @param defaultValue default value as source text, or null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConfigurableVariable(
    String name,
    VariableType type,
    String description,
    String defaultValue
) {
    public ConfigurableVariable {
        Objects.requireNonNull(name, "name must not be null");
        if (type == null) {
            type = VariableType.STRING;
        }
        if (description == null) {
            description = "";
        }
    }

    @JsonIgnore
    public boolean isEnvironment() {
        return type == VariableType.ENV;
    }
}
