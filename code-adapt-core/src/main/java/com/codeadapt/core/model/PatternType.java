package com.codeadapt.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of stylistic pattern that can be detected and converted.
 */
public enum PatternType {
    NAMING("naming"),
    IMPORTS("imports"),
    ERROR_HANDLING("error-handling");

    private final String id;

    PatternType(String id) {
        this.id = id;
    }

    /**
     * Returns the identifier used in JSON, YAML and directive values.
     */
    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Looks up a value by identifier, ignoring case.
     *
     * @param id identifier such as {@code "naming"}
     * @return matching value, or null if the identifier is unknown
     */
    @JsonCreator
    public static PatternType fromId(String id) {
        if (id == null) {
            return null;
        }
        for (PatternType value : values()) {
            if (value.id.equalsIgnoreCase(id.trim())) {
                return value;
            }
        }
        return null;
    }
}
