package com.codeadapt.core.directive;

import com.codeadapt.core.directive.TransformationDirective.*;

/**
 * Visitor over the directive types.
 *
 * @param <R> result type
 */
public interface DirectiveVisitor<R> {

    R visitRename(Rename rename);

    R visitReplaceImport(ReplaceImport replaceImport);

    R visitInject(Inject inject);

    R visitPatternChange(PatternChange patternChange);

    R visitConfigure(Configure configure);
}
