package com.codeadapt.core.analysis;

import com.codeadapt.core.ast.AstRewriter;
import com.codeadapt.core.ast.JavaScriptAst.*;
import com.codeadapt.core.model.ErrorHandlingStyle;
import com.codeadapt.core.model.ImportStyle;
import com.codeadapt.core.model.NamingConvention;
import com.codeadapt.core.parser.JavaScriptAstParser;
import com.codeadapt.core.util.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Detects the naming convention, import style and error-handling idiom of a program.
 *
 * <p>Detection is heuristic:
 * <ul>
 *   <li>Naming - referenced identifiers (not declarations, not builtins) are classified by
 *       shape; the most frequent convention wins, ties go to camelCase, then snake_case,
 *       then PascalCase, then kebab-case.</li>
 *   <li>Imports - each import declaration with bindings is default, named, namespace or
 *       mixed; the most frequent style wins and a tie between the leaders is mixed.</li>
 *   <li>Error handling - any try statement means exceptions, otherwise any
 *       {@code .catch(...)} call means promises.</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PatternAnalysis analysis = new PatternAnalyzer().analyze(program);
 * if (analysis.naming() == NamingConvention.SNAKE_CASE) { ... }
 * }</pre>
 */
public class PatternAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(PatternAnalyzer.class);

    public PatternAnalysis analyze(String source) {
        return analyze(JavaScriptAstParser.parse(source));
    }

    public PatternAnalysis analyze(Program program) {
        Objects.requireNonNull(program, "program must not be null");
        PatternAnalysis analysis = new PatternAnalysis(
            detectNaming(program),
            detectImportStyle(program),
            detectErrorHandling(program));
        log.debug("Detected naming={}, imports={}, errorHandling={}",
            analysis.naming().id(), analysis.importStyle().id(), analysis.errorHandling().id());
        return analysis;
    }

    NamingConvention detectNaming(Program program) {
        Map<NamingConvention, Integer> counts = new EnumMap<>(NamingConvention.class);
        for (String name : ReferenceCollector.collect(program)) {
            if (Identifiers.isBuiltin(name)) {
                continue;
            }
            for (NamingConvention convention : NamingConvention.values()) {
                if (convention.matches(name)) {
                    counts.merge(convention, 1, Integer::sum);
                    break;
                }
            }
        }
        NamingConvention best = NamingConvention.UNDETERMINED;
        int bestCount = 0;
        // Declaration order is the tie-break priority, so only a strictly larger count wins.
        for (NamingConvention convention : NamingConvention.values()) {
            int count = counts.getOrDefault(convention, 0);
            if (count > bestCount) {
                best = convention;
                bestCount = count;
            }
        }
        return best;
    }

    ImportStyle detectImportStyle(Program program) {
        Map<ImportStyle, Integer> counts = new EnumMap<>(ImportStyle.class);
        for (Statement statement : program.body()) {
            if (statement instanceof ImportDeclaration importDeclaration && !importDeclaration.isSideEffectOnly()) {
                counts.merge(classify(importDeclaration), 1, Integer::sum);
            }
        }
        if (counts.isEmpty()) {
            return ImportStyle.UNDETERMINED;
        }
        List<Map.Entry<ImportStyle, Integer>> ranked = counts.entrySet().stream()
            .sorted(Map.Entry.<ImportStyle, Integer>comparingByValue().reversed())
            .toList();
        if (ranked.size() > 1 && ranked.get(0).getValue().equals(ranked.get(1).getValue())) {
            return ImportStyle.MIXED;
        }
        return ranked.get(0).getKey();
    }

    private static ImportStyle classify(ImportDeclaration importDeclaration) {
        boolean hasDefault = importDeclaration.defaultBinding() != null;
        boolean hasNamespace = importDeclaration.namespaceBinding() != null;
        boolean hasNamed = !importDeclaration.specifiers().isEmpty();
        if (hasDefault && (hasNamed || hasNamespace)) {
            return ImportStyle.MIXED;
        } else if (hasDefault) {
            return ImportStyle.DEFAULT;
        } else if (hasNamespace) {
            return ImportStyle.NAMESPACE;
        }
        return ImportStyle.NAMED;
    }

    ErrorHandlingStyle detectErrorHandling(Program program) {
        ErrorHandlingCounter counter = new ErrorHandlingCounter();
        counter.rewriteProgram(program);
        if (counter.tryStatements > 0) {
            return ErrorHandlingStyle.EXCEPTIONS;
        } else if (counter.catchCalls > 0) {
            return ErrorHandlingStyle.PROMISES;
        }
        return ErrorHandlingStyle.UNDETERMINED;
    }

    private static final class ErrorHandlingCounter extends AstRewriter {
        private int tryStatements;
        private int catchCalls;

        @Override
        public Node visitTryStatement(TryStatement tryStatement) {
            tryStatements++;
            return super.visitTryStatement(tryStatement);
        }

        @Override
        public Node visitCallExpression(CallExpression callExpression) {
            if (callExpression.callee() instanceof MemberExpression member && "catch".equals(member.property())) {
                catchCalls++;
            }
            return super.visitCallExpression(callExpression);
        }
    }
}
