package com.codeadapt.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Error-handling idiom of a component or of a target project.
 */
public enum ErrorHandlingStyle {
    EXCEPTIONS("exceptions"),
    PROMISES("promises"),
    ASYNC_AWAIT("async-await"),
    RESULT_TYPES("result-types"),
    CALLBACKS("callbacks"),
    UNDETERMINED("undetermined");

    private final String id;

    ErrorHandlingStyle(String id) {
        this.id = id;
    }

    /**
     * Returns the identifier used in JSON, YAML and directive values.
     */
    @JsonValue
    public String id() {
        return id;
    }

    /** Case-insensitive lookup; unknown identifiers map to null. */
    @JsonCreator
    public static ErrorHandlingStyle fromId(String id) {
        if (id == null) {
            return null;
        }
        for (ErrorHandlingStyle value : values()) {
            if (value.id.equalsIgnoreCase(id.trim())) {
                return value;
            }
        }
        return null;
    }
}
