package com.codeadapt.core.model;

import com.codeadapt.core.generator.StyleConfig;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Conventions of the project a component is adapted into.
 *
 * <p>Every convention is optional; a null value means the target has no preference and the
 * component keeps its current style for that aspect.
 *
 * @param namingConvention identifier naming convention
 * @param importStyle preferred import style
 * @param exportStyle preferred export style, used for the usage example
 * @param errorHandling preferred error handling idiom
 * @param asyncPattern preferred asynchronous idiom, consulted when errorHandling is null
 * @param typescript whether the target project uses TypeScript
 * @param framework target framework, e.g. {@code react}
 * @param packageManager {@code npm}, {@code yarn}, {@code pnpm} or {@code bun}
 * @param installedDependencies packages the target project already installs
 * @param style formatting style for the adapted code
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TargetContext(
    NamingConvention namingConvention,
    ImportStyle importStyle,
    ExportStyle exportStyle,
    ErrorHandlingStyle errorHandling,
    ErrorHandlingStyle asyncPattern,
    boolean typescript,
    String framework,
    String packageManager,
    List<String> installedDependencies,
    StyleConfig style
) {
    public TargetContext {
        installedDependencies = installedDependencies != null ? List.copyOf(installedDependencies) : List.of();
    }

    /**
     * A target without any preference.
     */
    public static TargetContext empty() {
        return new TargetContext(null, null, null, null, null, false, null, null, List.of(), null);
    }
}
