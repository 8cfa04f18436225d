package com.codeadapt.core.transform;

import com.codeadapt.core.ast.JavaScriptAst.Program;

/**
 * One step of the transformation fold: a pure function from program to program.
 *
 * <p>A pass that cannot apply its directive returns the program unchanged and records a
 * warning in the context. Passes never throw for a directive that does not match.
 */
@FunctionalInterface
public interface TransformationPass {

    Program apply(Program program, TransformContext context);
}
