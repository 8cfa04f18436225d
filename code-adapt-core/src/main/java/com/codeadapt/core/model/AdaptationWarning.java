package com.codeadapt.core.model;

import java.util.Objects;

/**
 * A condition that was skipped or degraded while planning or applying an adaptation.
 *
 * @param type warning category
 * @param message human-readable description naming the directive or element involved
 */
public record AdaptationWarning(
    WarningType type,
    String message
) {
    public AdaptationWarning {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }
}
