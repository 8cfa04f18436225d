package com.codeadapt.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where injected code is placed relative to an injection point.
 */
public enum InjectionPosition {
    BEFORE("before"),
    AFTER("after"),
    REPLACE("replace"),
    WRAP("wrap");

    private final String id;

    InjectionPosition(String id) {
        this.id = id;
    }

    /**
     * Returns the identifier used in JSON, YAML and directive values.
     */
    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static InjectionPosition fromId(String id) {
        if (id == null) {
            return null;
        }
        for (InjectionPosition value : values()) {
            if (value.id.equalsIgnoreCase(id.trim())) {
                return value;
            }
        }
        return null;
    }
}
