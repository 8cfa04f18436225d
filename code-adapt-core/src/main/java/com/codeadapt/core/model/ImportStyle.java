package com.codeadapt.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Import style of a module: how bindings are pulled from other modules.
 */
public enum ImportStyle {
    DEFAULT("default"),
    NAMED("named"),
    NAMESPACE("namespace"),
    MIXED("mixed"),
    UNDETERMINED("undetermined");

    private final String id;

    ImportStyle(String id) {
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
     * @param id identifier such as {@code "default"}
     * @return matching value, or null if the identifier is unknown
     */
    @JsonCreator
    public static ImportStyle fromId(String id) {
        if (id == null) {
            return null;
        }
        for (ImportStyle value : values()) {
            if (value.id.equalsIgnoreCase(id.trim())) {
                return value;
            }
        }
        return null;
    }
}
