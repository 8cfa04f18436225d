package com.codeadapt.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Value type of a configurable variable. {@code ENV} marks a {@code process.env} lookup.
 */
public enum VariableType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    OBJECT("object"),
    ARRAY("array"),
    ENV("env");

    private final String id;

    VariableType(String id) {
        this.id = id;
    }

    /**
     * Returns the identifier used in JSON, YAML and directive values.
     */
    @JsonValue
    public String id() {
        return id;
    }

    // null for anything outside the vocabulary
    @JsonCreator
    public static VariableType fromId(String id) {
        if (id == null) {
            return null;
        }
        for (VariableType value : values()) {
            if (value.id.equalsIgnoreCase(id.trim())) {
                return value;
            }
        }
        return null;
    }
}
