package com.codeadapt.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Export style a consuming project expects from a component module.
 */
public enum ExportStyle {
    NAMED("named"),
    DEFAULT("default"),
    COMMONJS("commonjs");

    private final String id;

    ExportStyle(String id) {
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
     * @param id identifier such as {@code "named"}
     * @return matching value, or null if the identifier is unknown
     */
    @JsonCreator
    public static ExportStyle fromId(String id) {
        if (id == null) {
            return null;
        }
        for (ExportStyle value : values()) {
            if (value.id.equalsIgnoreCase(id.trim())) {
                return value;
            }
        }
        return null;
    }
}
