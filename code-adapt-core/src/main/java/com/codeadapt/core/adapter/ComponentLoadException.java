package com.codeadapt.core.adapter;

/**
 * Thrown when a component, target context or plan cannot be read.
 */
public class ComponentLoadException extends RuntimeException {

    public ComponentLoadException(String message) {
        super(message);
    }

    public ComponentLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
