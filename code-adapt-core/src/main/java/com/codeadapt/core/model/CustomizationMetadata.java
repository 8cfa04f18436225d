package com.codeadapt.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Optional;

/**
 * Describes how a component may be customized.
 *
 * @param variables configurable variables
 * @param injectionPoints declared injection points
 * @param patterns detected stylistic patterns
 * @param dependencies package names the component imports
 * @param framework detected framework, or null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CustomizationMetadata(
    List<ConfigurableVariable> variables,
    List<InjectionPoint> injectionPoints,
    List<PatternDescriptor> patterns,
    List<String> dependencies,
    String framework
) {
    public CustomizationMetadata {
        variables = variables != null ? List.copyOf(variables) : List.of();
        injectionPoints = injectionPoints != null ? List.copyOf(injectionPoints) : List.of();
        patterns = patterns != null ? List.copyOf(patterns) : List.of();
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    }

    public static CustomizationMetadata empty() {
        return new CustomizationMetadata(List.of(), List.of(), List.of(), List.of(), null);
    }

    public Optional<ConfigurableVariable> findVariable(String name) {
        return variables.stream().filter(v -> v.name().equals(name)).findFirst();
    }

    public Optional<InjectionPoint> findInjectionPoint(String id) {
        return injectionPoints.stream().filter(p -> p.id().equals(id)).findFirst();
    }

    public Optional<PatternDescriptor> findPattern(PatternType type) {
        return patterns.stream().filter(p -> p.type() == type).findFirst();
    }
}
