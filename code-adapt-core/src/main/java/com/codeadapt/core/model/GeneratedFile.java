package com.codeadapt.core.model;

import java.util.Objects;

/**
 * A file produced by an adaptation.
 *
 * @param relativePath relative path for the file (e.g., "auth-client.ts")
 * @param content file content
 * @param description what the file is for
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String description
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
