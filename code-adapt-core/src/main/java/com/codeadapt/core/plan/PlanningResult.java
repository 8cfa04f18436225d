package com.codeadapt.core.plan;

import com.codeadapt.core.model.AdaptationPlan;
import com.codeadapt.core.model.AdaptationWarning;

import java.util.List;
import java.util.Objects;

/**
 * A validated plan with the setup steps and warnings produced while building it.
 *
 * @param plan validated plan
 * @param setupSteps setup instructions that do not translate into directives
 * @param warnings warnings for dropped directives and unavailable suggestions
 */
public record PlanningResult(
    AdaptationPlan plan,
    List<String> setupSteps,
    List<AdaptationWarning> warnings
) {
    public PlanningResult {
        Objects.requireNonNull(plan, "plan must not be null");
        setupSteps = setupSteps != null ? List.copyOf(setupSteps) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
