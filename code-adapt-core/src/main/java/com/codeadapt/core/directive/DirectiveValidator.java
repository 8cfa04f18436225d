package com.codeadapt.core.directive;

import com.codeadapt.core.directive.TransformationDirective.*;
import com.codeadapt.core.model.AdaptationWarning;
import com.codeadapt.core.model.CustomizationMetadata;
import com.codeadapt.core.model.ErrorHandlingStyle;
import com.codeadapt.core.model.ImportStyle;
import com.codeadapt.core.model.InjectionPoint;
import com.codeadapt.core.model.NamingConvention;
import com.codeadapt.core.model.PatternType;
import com.codeadapt.core.model.WarningType;
import com.codeadapt.core.parser.JavaScriptAstParser;
import com.codeadapt.core.parser.JavaScriptParseException;
import com.codeadapt.core.util.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Checks directives against a component's customization metadata when a plan is built.
 *
 * <p>Invalid directives are dropped with exactly one warning each; valid directives keep
 * their order. Inject directives without a position get the kind of their injection point.
 * A rename or pattern change whose old and new values are equal is a no-op and is always
 * accepted.
 *
 * <ul>
 *   <li>rename: both names are identifiers, the new name is not reserved, the old name is
 *       not a builtin</li>
 *   <li>replace-import: both module names are non-blank</li>
 *   <li>inject: the point is declared and the code parses as statements</li>
 *   <li>pattern: the kind is known and both values belong to its vocabulary</li>
 *   <li>configure: the variable is declared and a value is given</li>
 * </ul>
 */
public class DirectiveValidator {

    private static final Logger log = LoggerFactory.getLogger(DirectiveValidator.class);

    private final CustomizationMetadata metadata;
    private final Set<String> extraBuiltins;

    public DirectiveValidator(CustomizationMetadata metadata) {
        this(metadata, Set.of());
    }

    public DirectiveValidator(CustomizationMetadata metadata, Set<String> extraBuiltins) {
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
        this.extraBuiltins = extraBuiltins != null ? Set.copyOf(extraBuiltins) : Set.of();
    }

    /**
     * Validates directives in order.
     *
     * @param directives directives to check
     * @return accepted directives and one warning per rejected directive
     */
    public ValidationResult validate(List<TransformationDirective> directives) {
        List<TransformationDirective> accepted = new ArrayList<>();
        List<AdaptationWarning> warnings = new ArrayList<>();
        Checker checker = new Checker();
        for (TransformationDirective directive : directives) {
            if (directive == null) {
                continue;
            }
            AdaptationWarning warning = directive.accept(checker);
            if (warning != null) {
                log.warn("Dropping directive '{}': {}", directive.describe(), warning.message());
                warnings.add(warning);
            } else {
                accepted.add(withDefaults(directive));
            }
        }
        log.debug("Validated {} directives: {} accepted, {} dropped",
            directives.size(), accepted.size(), warnings.size());
        return new ValidationResult(accepted, warnings);
    }

    private TransformationDirective withDefaults(TransformationDirective directive) {
        if (directive instanceof Inject inject && inject.position() == null) {
            InjectionPoint point = metadata.findInjectionPoint(inject.pointId()).orElseThrow();
            return inject.withPosition(point.kind());
        }
        return directive;
    }

    private static AdaptationWarning invalid(String message) {
        return new AdaptationWarning(WarningType.INVALID_DIRECTIVE, message);
    }

    /**
     * Returns a warning for an invalid directive, or null if it is valid.
     */
    private final class Checker implements DirectiveVisitor<AdaptationWarning> {

        @Override
        public AdaptationWarning visitRename(Rename rename) {
            if (rename.from() != null && rename.from().equals(rename.to())) {
                return null;
            }
            if (!Identifiers.isIdentifier(rename.from()) || !Identifiers.isIdentifier(rename.to())) {
                return invalid("Rename needs identifier names, got '" + rename.from() + "' -> '" + rename.to() + "'");
            }
            if (Identifiers.isReservedWord(rename.to())) {
                return invalid("Cannot rename '" + rename.from() + "' to reserved word '" + rename.to() + "'");
            }
            if (Identifiers.isBuiltin(rename.from()) || extraBuiltins.contains(rename.from())) {
                return invalid("Cannot rename builtin '" + rename.from() + "'");
            }
            return null;
        }

        @Override
        public AdaptationWarning visitReplaceImport(ReplaceImport replaceImport) {
            if (isBlank(replaceImport.from()) || isBlank(replaceImport.to())) {
                return invalid("Import replacement needs both module names, got '"
                    + replaceImport.from() + "' -> '" + replaceImport.to() + "'");
            }
            return null;
        }

        @Override
        public AdaptationWarning visitInject(Inject inject) {
            Optional<InjectionPoint> point = metadata.findInjectionPoint(inject.pointId());
            if (point.isEmpty()) {
                return new AdaptationWarning(WarningType.UNRESOLVED_INJECTION_POINT,
                    "Unknown injection point '" + inject.pointId() + "'");
            }
            if (inject.code() == null) {
                return invalid("Injection at '" + inject.pointId() + "' has no code");
            }
            try {
                JavaScriptAstParser.parseStatements(inject.code());
            } catch (JavaScriptParseException e) {
                return invalid("Injected code for '" + inject.pointId() + "' does not parse: " + e.getMessage());
            }
            return null;
        }

        @Override
        public AdaptationWarning visitPatternChange(PatternChange patternChange) {
            PatternType pattern = patternChange.pattern();
            if (pattern == null) {
                return invalid("Unknown pattern kind in '" + patternChange.describe() + "'");
            }
            if (patternChange.from() != null && patternChange.from().equalsIgnoreCase(patternChange.to())) {
                return null;
            }
            if (!inVocabulary(pattern, patternChange.from()) || !inVocabulary(pattern, patternChange.to())) {
                return invalid("Values '" + patternChange.from() + "' -> '" + patternChange.to()
                    + "' are not valid for pattern " + pattern.id());
            }
            return null;
        }

        @Override
        public AdaptationWarning visitConfigure(Configure configure) {
            if (configure.variable() == null || metadata.findVariable(configure.variable()).isEmpty()) {
                return new AdaptationWarning(WarningType.UNKNOWN_CONFIGURE_VARIABLE,
                    "Unknown configurable variable '" + configure.variable() + "'");
            }
            if (configure.value() == null) {
                return invalid("Configure of '" + configure.variable() + "' has no value");
            }
            return null;
        }
    }

    /**
     * Returns true if the value names a concrete style of the pattern kind.
     */
    static boolean inVocabulary(PatternType pattern, String value) {
        return switch (pattern) {
            case NAMING -> {
                NamingConvention convention = NamingConvention.fromId(value);
                yield convention != null && convention != NamingConvention.UNDETERMINED;
            }
            case IMPORTS -> {
                ImportStyle style = ImportStyle.fromId(value);
                yield style != null && style != ImportStyle.UNDETERMINED;
            }
            case ERROR_HANDLING -> {
                ErrorHandlingStyle style = ErrorHandlingStyle.fromId(value);
                yield style != null && style != ErrorHandlingStyle.UNDETERMINED;
            }
        };
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
