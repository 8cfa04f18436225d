package com.codeadapt.core.transform;

import com.codeadapt.core.ast.JavaScriptAst.Program;
import com.codeadapt.core.model.AdaptationWarning;

import java.util.List;
import java.util.Objects;

/**
 * Program after all passes, with the warnings the passes recorded.
 *
 * @param program transformed program
 * @param warnings warnings in the order they were recorded
 */
public record TransformResult(
    Program program,
    List<AdaptationWarning> warnings
) {
    public TransformResult {
        Objects.requireNonNull(program, "program must not be null");
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
