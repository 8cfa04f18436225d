package com.codeadapt.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Output of adapting one component.
 *
 * @param originalMetadata metadata of the component before adaptation
 * @param code adapted and formatted source
 * @param filename suggested file name for the adapted source
 * @param files the main file (attribution header plus code) followed by the plan additions
 * @param instructions install, setup and usage instructions
 * @param attribution attribution header prepended to the code
 * @param appliedPlan the plan that produced the code
 * @param warnings every skipped or degraded step, in the order it happened
 */
public record AdaptedResult(
    CustomizationMetadata originalMetadata,
    String code,
    String filename,
    List<GeneratedFile> files,
    Instructions instructions,
    String attribution,
    AdaptationPlan appliedPlan,
    List<AdaptationWarning> warnings
) {
    public AdaptedResult {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(filename, "filename must not be null");
        files = files != null ? List.copyOf(files) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
