package com.codeadapt.core.model;

import com.codeadapt.core.directive.TransformationDirective;

import java.util.List;
import java.util.Objects;

/**
 * Ordered transformations for one component.
 *
 * @param componentId id of the component the plan applies to
 * @param transformations validated directives in execution order
 * @param additions extra files delivered with the adapted component
 */
public record AdaptationPlan(
    String componentId,
    List<TransformationDirective> transformations,
    List<GeneratedFile> additions
) {
    public AdaptationPlan {
        Objects.requireNonNull(componentId, "componentId must not be null");
        transformations = transformations != null ? List.copyOf(transformations) : List.of();
        additions = additions != null ? List.copyOf(additions) : List.of();
    }
}
