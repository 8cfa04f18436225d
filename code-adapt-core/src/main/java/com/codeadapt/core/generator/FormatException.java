package com.codeadapt.core.generator;

/**
 * Thrown when generated code cannot be formatted.
 *
 * <p>Formatting is best-effort: callers keep the unformatted generator output and record a
 * warning instead of failing the request.
 */
public class FormatException extends RuntimeException {

    public FormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
