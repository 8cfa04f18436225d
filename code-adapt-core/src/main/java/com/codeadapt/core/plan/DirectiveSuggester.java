package com.codeadapt.core.plan;

import java.util.List;

/**
 * External source of additional transformation directives, such as a language model.
 *
 * <p>Implementations may block; the plan builder calls them off the calling thread and
 * gives up after its configured timeout.
 */
@FunctionalInterface
public interface DirectiveSuggester {

    /**
     * Suggests directives for a component.
     *
     * @param code component source
     * @param targetPatterns descriptions of the target conventions, e.g. {@code "snake_case naming convention"}
     * @param framework target framework, or null
     * @param constraints free-form constraints the suggestions must respect
     * @return suggestions, possibly empty
     */
    List<DirectiveSuggestion> suggest(String code, List<String> targetPatterns, String framework, List<String> constraints);
}
