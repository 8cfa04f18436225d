package com.codeadapt.core.directive;

import com.codeadapt.core.model.AdaptationWarning;

import java.util.List;

/**
 * Outcome of validating a directive list.
 *
 * @param directives directives that passed validation, in their original order
 * @param warnings one warning per dropped directive
 */
public record ValidationResult(
    List<TransformationDirective> directives,
    List<AdaptationWarning> warnings
) {
    public ValidationResult {
        directives = directives != null ? List.copyOf(directives) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
