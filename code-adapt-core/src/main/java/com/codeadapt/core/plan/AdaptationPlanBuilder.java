package com.codeadapt.core.plan;

import com.codeadapt.core.directive.DirectiveValidator;
import com.codeadapt.core.directive.TransformationDirective;
import com.codeadapt.core.directive.TransformationDirective.Configure;
import com.codeadapt.core.directive.TransformationDirective.PatternChange;
import com.codeadapt.core.directive.ValidationResult;
import com.codeadapt.core.model.AdaptationPlan;
import com.codeadapt.core.model.AdaptationWarning;
import com.codeadapt.core.model.Component;
import com.codeadapt.core.model.ConfigurableVariable;
import com.codeadapt.core.model.CustomizationMetadata;
import com.codeadapt.core.model.ErrorHandlingStyle;
import com.codeadapt.core.model.GeneratedFile;
import com.codeadapt.core.model.ImportStyle;
import com.codeadapt.core.model.NamingConvention;
import com.codeadapt.core.model.PatternDescriptor;
import com.codeadapt.core.model.PatternType;
import com.codeadapt.core.model.TargetContext;
import com.codeadapt.core.model.WarningType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Builds a validated {@link AdaptationPlan} for a component and a target project.
 *
 * <p>Directives are collected in this order:
 * <ol>
 *   <li>pattern changes for every detected pattern that differs from the target
 *       (naming, imports, then error handling; the target's async pattern stands in when it
 *       has no error handling preference)</li>
 *   <li>suggestions at or above the confidence threshold, when a suggester is configured</li>
 *   <li>configure directives for customizations; customizations of environment variables
 *       become setup steps instead</li>
 * </ol>
 * The list is then run through the {@link DirectiveValidator}.
 *
 * <p>The suggester runs on its own worker thread, which is interrupted after the timeout; the plan is then
 * built without suggestions and carries a {@code SUGGESTION_UNAVAILABLE} warning.
 */
public class AdaptationPlanBuilder {

    private static final Logger log = LoggerFactory.getLogger(AdaptationPlanBuilder.class);

    public static final long DEFAULT_TIMEOUT_MILLIS = 10_000;
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;

    private final DirectiveSuggester suggester;
    private final long timeoutMillis;
    private final double confidenceThreshold;
    private final Set<String> extraBuiltins;

    /**
     * Creates a builder without suggestions.
     */
    public AdaptationPlanBuilder() {
        this(null, DEFAULT_TIMEOUT_MILLIS, DEFAULT_CONFIDENCE_THRESHOLD, Set.of());
    }

    /**
     * @param suggester suggestion source, or null to disable suggestions
     * @param timeoutMillis how long to wait for suggestions
     * @param confidenceThreshold minimum confidence of accepted suggestions
     * @param extraBuiltins names the validator treats as builtins
     */
    public AdaptationPlanBuilder(DirectiveSuggester suggester, long timeoutMillis, double confidenceThreshold,
                                 Set<String> extraBuiltins) {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("timeoutMillis must be positive: " + timeoutMillis);
        }
        this.suggester = suggester;
        this.timeoutMillis = timeoutMillis;
        this.confidenceThreshold = confidenceThreshold;
        this.extraBuiltins = extraBuiltins != null ? Set.copyOf(extraBuiltins) : Set.of();
    }

    public PlanningResult build(Component component, TargetContext target, Map<String, String> customizations) {
        return build(component, target, customizations, List.of());
    }

    /**
     * Builds the plan.
     *
     * @param component cataloged component
     * @param target target project conventions
     * @param customizations variable values keyed by variable name, may be null
     * @param additions extra files delivered with the component
     * @return validated plan, setup steps and warnings
     */
    public PlanningResult build(Component component, TargetContext target, Map<String, String> customizations,
                                List<GeneratedFile> additions) {
        Objects.requireNonNull(component, "component must not be null");
        TargetContext context = target != null ? target : TargetContext.empty();
        CustomizationMetadata metadata = component.metadata();
        log.info("Building adaptation plan for component '{}'", component.id());

        List<TransformationDirective> directives = new ArrayList<>(patternChanges(metadata, context));
        List<AdaptationWarning> warnings = new ArrayList<>();
        if (suggester != null) {
            directives.addAll(suggestions(component, context, customizations, warnings));
        }

        List<String> setupSteps = new ArrayList<>();
        List<String> environment = new ArrayList<>();
        if (customizations != null) {
            customizations.forEach((name, value) -> {
                Optional<ConfigurableVariable> variable = metadata.findVariable(name);
                if (variable.isPresent() && variable.get().isEnvironment()) {
                    environment.add(name + "=" + value);
                } else {
                    directives.add(new Configure(name, value));
                }
            });
        }
        for (ConfigurableVariable variable : metadata.variables()) {
            if (variable.isEnvironment() && (customizations == null || !customizations.containsKey(variable.name()))) {
                environment.add(variable.name());
            }
        }
        if (!environment.isEmpty()) {
            setupSteps.add("Set environment variables: " + String.join(", ", environment));
        }

        ValidationResult validation = new DirectiveValidator(metadata, extraBuiltins).validate(directives);
        warnings.addAll(validation.warnings());
        AdaptationPlan plan = new AdaptationPlan(component.id(), validation.directives(), additions);
        log.info("Plan for '{}' has {} transformations and {} warnings",
            component.id(), plan.transformations().size(), warnings.size());
        return new PlanningResult(plan, setupSteps, warnings);
    }

    List<TransformationDirective> patternChanges(CustomizationMetadata metadata, TargetContext target) {
        List<TransformationDirective> changes = new ArrayList<>();
        NamingConvention naming = target.namingConvention();
        if (naming != null && naming != NamingConvention.UNDETERMINED) {
            patternChange(metadata, PatternType.NAMING, naming, NamingConvention::fromId, NamingConvention.UNDETERMINED)
                .ifPresent(changes::add);
        }
        ImportStyle imports = target.importStyle();
        if (imports != null && imports != ImportStyle.UNDETERMINED) {
            patternChange(metadata, PatternType.IMPORTS, imports, ImportStyle::fromId, ImportStyle.UNDETERMINED)
                .ifPresent(changes::add);
        }
        ErrorHandlingStyle errorHandling = target.errorHandling() != null ? target.errorHandling() : target.asyncPattern();
        if (errorHandling != null && errorHandling != ErrorHandlingStyle.UNDETERMINED) {
            patternChange(metadata, PatternType.ERROR_HANDLING, errorHandling, ErrorHandlingStyle::fromId,
                ErrorHandlingStyle.UNDETERMINED).ifPresent(changes::add);
        }
        return changes;
    }

    /**
     * Returns a change from the component's current style to the target style. Nothing is
     * returned when the current style is unknown, undetermined or already the target's.
     */
    private static <E extends Enum<E>> Optional<TransformationDirective> patternChange(
            CustomizationMetadata metadata, PatternType type, E to, Function<String, E> fromId, E undetermined) {
        E current = metadata.findPattern(type)
            .map(PatternDescriptor::current)
            .map(fromId)
            .orElse(null);
        if (current == null || current == undetermined || current == to) {
            return Optional.empty();
        }
        return Optional.of(new PatternChange(type, idOf(current), idOf(to)));
    }

    private static String idOf(Enum<?> style) {
        if (style instanceof NamingConvention naming) {
            return naming.id();
        }
        if (style instanceof ImportStyle imports) {
            return imports.id();
        }
        return ((ErrorHandlingStyle) style).id();
    }

    private List<TransformationDirective> suggestions(Component component, TargetContext target,
                                                     Map<String, String> customizations,
                                                     List<AdaptationWarning> warnings) {
        List<String> targetPatterns = targetPatterns(target);
        List<String> constraints = constraints(target, customizations);
        ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "directive-suggester");
            thread.setDaemon(true);
            return thread;
        });
        Future<List<DirectiveSuggestion>> future = executor.submit(
            () -> suggester.suggest(component.source(), targetPatterns, target.framework(), constraints));
        try {
            List<DirectiveSuggestion> suggested = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
            List<TransformationDirective> accepted = new ArrayList<>();
            if (suggested != null) {
                for (DirectiveSuggestion suggestion : suggested) {
                    if (suggestion.confidence() >= confidenceThreshold) {
                        accepted.add(suggestion.directive());
                    } else {
                        log.debug("Skipping suggestion '{}' with confidence {}",
                            suggestion.directive().describe(), suggestion.confidence());
                    }
                }
            }
            log.debug("Accepted {} suggested directives", accepted.size());
            return accepted;
        } catch (TimeoutException e) {
            future.cancel(true);
            return unavailable(warnings, "Suggestions timed out after " + timeoutMillis + " ms");
        } catch (ExecutionException e) {
            return unavailable(warnings, "Suggestions failed: " + e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return unavailable(warnings, "Interrupted while waiting for suggestions");
        } finally {
            executor.shutdownNow();
        }
    }

    private static List<TransformationDirective> unavailable(List<AdaptationWarning> warnings, String message) {
        log.warn("{}, using the plan without suggestions", message);
        warnings.add(new AdaptationWarning(WarningType.SUGGESTION_UNAVAILABLE, message));
        return List.of();
    }

    private static List<String> targetPatterns(TargetContext target) {
        List<String> patterns = new ArrayList<>();
        if (target.namingConvention() != null) {
            patterns.add(target.namingConvention().id() + " naming convention");
        }
        if (target.importStyle() != null) {
            patterns.add(target.importStyle().id() + " import style");
        }
        if (target.exportStyle() != null) {
            patterns.add(target.exportStyle().id() + " export style");
        }
        if (target.errorHandling() != null) {
            patterns.add(target.errorHandling().id() + " error handling");
        }
        if (target.asyncPattern() != null) {
            patterns.add(target.asyncPattern().id() + " async pattern");
        }
        return patterns;
    }

    private static List<String> constraints(TargetContext target, Map<String, String> customizations) {
        List<String> constraints = new ArrayList<>();
        if (target.framework() != null) {
            constraints.add("Must work with " + target.framework() + " framework");
        }
        if (!target.installedDependencies().isEmpty()) {
            List<String> installed = target.installedDependencies();
            constraints.add("Compatible with existing dependencies: "
                + String.join(", ", installed.subList(0, Math.min(5, installed.size()))));
        }
        if (customizations != null && !customizations.isEmpty()) {
            constraints.add("User customizations: " + customizations);
        }
        return constraints;
    }
}
