package com.codeadapt.core.transform;

import com.codeadapt.core.ast.JavaScriptAst.Program;
import com.codeadapt.core.directive.DirectiveVisitor;
import com.codeadapt.core.directive.TransformationDirective;
import com.codeadapt.core.directive.TransformationDirective.*;
import com.codeadapt.core.model.CustomizationMetadata;
import com.codeadapt.core.model.ErrorHandlingStyle;
import com.codeadapt.core.model.ImportStyle;
import com.codeadapt.core.model.NamingConvention;
import com.codeadapt.core.model.WarningType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Applies an ordered list of directives to a program.
 *
 * <p>The directives are folded over the program: each directive becomes one
 * {@link TransformationPass}, and each pass sees the program as left by all earlier ones.
 * Directives are expected to be validated already (see
 * {@link com.codeadapt.core.directive.DirectiveValidator}); a directive that matches nothing
 * leaves the program unchanged and adds a warning.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TransformResult result = new AstTransformer().apply(program, plan.transformations(), component.metadata());
 * String code = new JavaScriptCodeGenerator().generate(result.program());
 * }</pre>
 *
 * <p>Instances hold no per-run state and can be shared between threads.
 */
public class AstTransformer {

    private static final Logger log = LoggerFactory.getLogger(AstTransformer.class);

    private final Set<String> extraBuiltins;

    public AstTransformer() {
        this(Set.of());
    }

    /**
     * @param extraBuiltins names treated as builtins in addition to the standard list
     */
    public AstTransformer(Set<String> extraBuiltins) {
        this.extraBuiltins = extraBuiltins != null ? Set.copyOf(extraBuiltins) : Set.of();
    }

    /**
     * Applies the directives in order.
     *
     * @param program program to transform
     * @param directives validated directives, in execution order
     * @param metadata metadata injection points and variables are resolved against
     * @return transformed program and warnings
     */
    public TransformResult apply(Program program, List<TransformationDirective> directives, CustomizationMetadata metadata) {
        Objects.requireNonNull(program, "program must not be null");
        Objects.requireNonNull(directives, "directives must not be null");
        TransformContext context = new TransformContext(metadata != null ? metadata : CustomizationMetadata.empty(), extraBuiltins);

        Program current = program;
        for (TransformationDirective directive : directives) {
            TransformationPass pass = directive.accept(new PassFactory(context));
            log.debug("Applying {}", directive.describe());
            current = pass.apply(current, context);
        }
        log.info("Applied {} directives with {} warnings", directives.size(), context.warnings().size());
        return new TransformResult(current, context.warnings());
    }

    /**
     * Creates a fresh pass for each directive.
     */
    private static final class PassFactory implements DirectiveVisitor<TransformationPass> {

        private static final TransformationPass NO_OP = (program, context) -> program;

        private final TransformContext context;

        PassFactory(TransformContext context) {
            this.context = context;
        }

        @Override
        public TransformationPass visitRename(Rename rename) {
            return new RenamePass(rename);
        }

        @Override
        public TransformationPass visitReplaceImport(ReplaceImport replaceImport) {
            return new ReplaceImportPass(replaceImport);
        }

        @Override
        public TransformationPass visitInject(Inject inject) {
            return new InjectPass(inject);
        }

        @Override
        public TransformationPass visitPatternChange(PatternChange patternChange) {
            if (patternChange.isNoOp()) {
                return NO_OP;
            }
            return switch (patternChange.pattern()) {
                case NAMING -> new NamingConventionPass(
                    NamingConvention.fromId(patternChange.from()), NamingConvention.fromId(patternChange.to()));
                case IMPORTS -> new ImportStylePass(
                    ImportStyle.fromId(patternChange.from()), ImportStyle.fromId(patternChange.to()));
                case ERROR_HANDLING -> errorHandling(
                    ErrorHandlingStyle.fromId(patternChange.from()), ErrorHandlingStyle.fromId(patternChange.to()));
            };
        }

        private TransformationPass errorHandling(ErrorHandlingStyle from, ErrorHandlingStyle to) {
            if (from == ErrorHandlingStyle.EXCEPTIONS && to == ErrorHandlingStyle.PROMISES) {
                return new ExceptionsToPromisesPass();
            } else if (from == ErrorHandlingStyle.PROMISES && to == ErrorHandlingStyle.ASYNC_AWAIT) {
                return new PromisesToAsyncAwaitPass();
            } else if (from == ErrorHandlingStyle.EXCEPTIONS && to == ErrorHandlingStyle.RESULT_TYPES) {
                return new ExceptionsToResultTypesPass();
            } else if (from == ErrorHandlingStyle.ASYNC_AWAIT && to == ErrorHandlingStyle.PROMISES) {
                return new AsyncAwaitToPromisesPass();
            }
            return (program, ignored) -> {
                context.warn(WarningType.UNSUPPORTED_PATTERN_CONVERSION,
                    "Error handling conversion " + from.id() + " -> " + to.id() + " is not supported");
                return program;
            };
        }

        @Override
        public TransformationPass visitConfigure(Configure configure) {
            return new ConfigurePass(configure);
        }
    }
}
