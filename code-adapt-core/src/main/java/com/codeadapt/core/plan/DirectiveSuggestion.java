package com.codeadapt.core.plan;

import com.codeadapt.core.directive.TransformationDirective;

import java.util.Objects;

/**
 * A directive proposed by a {@link DirectiveSuggester}.
 *
 * @param directive proposed directive
 * @param confidence confidence between 0 and 1
 * @param reason short explanation
 */
public record DirectiveSuggestion(
    TransformationDirective directive,
    double confidence,
    String reason
) {
    public DirectiveSuggestion {
        Objects.requireNonNull(directive, "directive must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0 and 1: " + confidence);
        }
    }
}
