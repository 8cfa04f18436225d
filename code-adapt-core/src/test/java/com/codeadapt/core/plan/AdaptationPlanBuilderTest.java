package com.codeadapt.core.plan;

import com.codeadapt.core.directive.TransformationDirective;
import com.codeadapt.core.directive.TransformationDirective.Configure;
import com.codeadapt.core.directive.TransformationDirective.PatternChange;
import com.codeadapt.core.directive.TransformationDirective.Rename;
import com.codeadapt.core.model.AdaptationWarning;
import com.codeadapt.core.model.Component;
import com.codeadapt.core.model.ConfigurableVariable;
import com.codeadapt.core.model.CustomizationMetadata;
import com.codeadapt.core.model.ErrorHandlingStyle;
import com.codeadapt.core.model.ImportStyle;
import com.codeadapt.core.model.NamingConvention;
import com.codeadapt.core.model.PatternDescriptor;
import com.codeadapt.core.model.PatternType;
import com.codeadapt.core.model.TargetContext;
import com.codeadapt.core.model.VariableType;
import com.codeadapt.core.model.WarningType;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AdaptationPlanBuilder}.
 */
class AdaptationPlanBuilderTest {

    private static final CustomizationMetadata METADATA = new CustomizationMetadata(
        List.of(
            new ConfigurableVariable("apiUrl", VariableType.STRING, "API URL", "https://api.example.com"),
            new ConfigurableVariable("API_KEY", VariableType.ENV, "Environment variable: API_KEY", null),
            new ConfigurableVariable("REGION", VariableType.ENV, "Environment variable: REGION", null)),
        List.of(),
        List.of(
            new PatternDescriptor(PatternType.NAMING, "camelCase", ""),
            new PatternDescriptor(PatternType.IMPORTS, "default", ""),
            new PatternDescriptor(PatternType.ERROR_HANDLING, "exceptions", "")),
        List.of("axios"),
        null);

    private static final Component COMPONENT = new Component("client", "ApiClient", "const x = 1;", null, null,
        null, null, null, null, METADATA);

    private static TargetContext target(NamingConvention naming, ImportStyle imports,
                                        ErrorHandlingStyle errorHandling, ErrorHandlingStyle asyncPattern) {
        return new TargetContext(naming, imports, null, errorHandling, asyncPattern, false, "react", null, List.of(), null);
    }

    @Test
    void build_targetConventions_addsPatternChangesInOrder() {
        PlanningResult result = new AdaptationPlanBuilder().build(COMPONENT,
            target(NamingConvention.SNAKE_CASE, ImportStyle.NAMED, ErrorHandlingStyle.PROMISES, null), Map.of());

        assertThat(result.plan().transformations()).containsExactly(
            new PatternChange(PatternType.NAMING, "camelCase", "snake_case"),
            new PatternChange(PatternType.IMPORTS, "default", "named"),
            new PatternChange(PatternType.ERROR_HANDLING, "exceptions", "promises"));
        assertThat(result.plan().componentId()).isEqualTo("client");
    }

    @Test
    void build_matchingOrUndeterminedTarget_addsNoPatternChange() {
        PlanningResult result = new AdaptationPlanBuilder().build(COMPONENT,
            target(NamingConvention.CAMEL_CASE, ImportStyle.UNDETERMINED, null, null), Map.of());

        assertThat(result.plan().transformations()).isEmpty();
    }

    @Test
    void build_undeterminedOrMixedCaseDescriptor_addsOnlyRealChanges() {
        CustomizationMetadata metadata = new CustomizationMetadata(List.of(), List.of(),
            List.of(
                new PatternDescriptor(PatternType.NAMING, "undetermined", ""),
                new PatternDescriptor(PatternType.IMPORTS, "Named", ""),
                new PatternDescriptor(PatternType.ERROR_HANDLING, "EXCEPTIONS", "")),
            List.of(), null);
        Component component = new Component("mixed", "Mixed", "const x = 1;", null, null,
            null, null, null, null, metadata);

        PlanningResult result = new AdaptationPlanBuilder().build(component,
            target(NamingConvention.SNAKE_CASE, ImportStyle.NAMED, ErrorHandlingStyle.PROMISES, null), Map.of());

        assertThat(result.plan().transformations()).containsExactly(
            new PatternChange(PatternType.ERROR_HANDLING, "exceptions", "promises"));
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void build_asyncPatternWithoutErrorHandling_usesAsyncPattern() {
        AdaptationPlanBuilder builder = new AdaptationPlanBuilder();

        List<TransformationDirective> changes = builder.patternChanges(METADATA,
            target(null, null, null, ErrorHandlingStyle.RESULT_TYPES));

        assertThat(changes).containsExactly(
            new PatternChange(PatternType.ERROR_HANDLING, "exceptions", "result-types"));
    }

    @Test
    void build_customizations_becomeConfigureOrEnvironmentSteps() {
        Map<String, String> customizations = new LinkedHashMap<>();
        customizations.put("apiUrl", "'https://staging.example.com'");
        customizations.put("API_KEY", "secret");

        PlanningResult result = new AdaptationPlanBuilder().build(COMPONENT, TargetContext.empty(), customizations);

        assertThat(result.plan().transformations())
            .containsExactly(new Configure("apiUrl", "'https://staging.example.com'"));
        assertThat(result.setupSteps()).containsExactly("Set environment variables: API_KEY=secret, REGION");
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void build_unknownCustomization_droppedWithOneWarning() {
        PlanningResult result = new AdaptationPlanBuilder().build(COMPONENT, TargetContext.empty(),
            Map.of("doesNotExist", "1"));

        assertThat(result.plan().transformations()).isEmpty();
        assertThat(result.warnings()).extracting(AdaptationWarning::type)
            .containsExactly(WarningType.UNKNOWN_CONFIGURE_VARIABLE);
    }

    @Test
    void build_suggestions_keepsOnlyConfidentOnes() {
        AtomicReference<String> framework = new AtomicReference<>();
        DirectiveSuggester suggester = (code, patterns, fw, constraints) -> {
            framework.set(fw);
            return List.of(
                new DirectiveSuggestion(new Rename("identifier", "x", "count"), 0.9, "clearer name"),
                new DirectiveSuggestion(new Rename("identifier", "x", "value"), 0.4, "guess"));
        };
        AdaptationPlanBuilder builder = new AdaptationPlanBuilder(suggester, 1_000, 0.7, Set.of());

        PlanningResult result = builder.build(COMPONENT, target(null, null, null, null), Map.of());

        assertThat(result.plan().transformations()).containsExactly(new Rename("identifier", "x", "count"));
        assertThat(framework.get()).isEqualTo("react");
    }

    @Test
    void build_slowSuggester_timesOutWithWarning() {
        DirectiveSuggester slow = (code, patterns, framework, constraints) -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of(new DirectiveSuggestion(new Rename("identifier", "x", "y"), 1.0, "late"));
        };
        AdaptationPlanBuilder builder = new AdaptationPlanBuilder(slow, 50, 0.7, Set.of());

        PlanningResult result = builder.build(COMPONENT,
            target(NamingConvention.SNAKE_CASE, null, null, null), Map.of());

        assertThat(result.plan().transformations())
            .containsExactly(new PatternChange(PatternType.NAMING, "camelCase", "snake_case"));
        assertThat(result.warnings()).singleElement().satisfies(w -> {
            assertThat(w.type()).isEqualTo(WarningType.SUGGESTION_UNAVAILABLE);
            assertThat(w.message()).isEqualTo("Suggestions timed out after 50 ms");
        });
    }

    @Test
    void build_slowSuggester_isInterruptedAfterTimeout() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        DirectiveSuggester slow = (code, patterns, framework, constraints) -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return List.of();
        };
        AdaptationPlanBuilder builder = new AdaptationPlanBuilder(slow, 50, 0.7, Set.of());

        builder.build(COMPONENT, TargetContext.empty(), Map.of());

        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void build_failingSuggester_continuesWithWarning() {
        DirectiveSuggester failing = (code, patterns, framework, constraints) -> {
            throw new IllegalStateException("service unavailable");
        };
        AdaptationPlanBuilder builder = new AdaptationPlanBuilder(failing, 1_000, 0.7, Set.of());

        PlanningResult result = builder.build(COMPONENT, TargetContext.empty(), null);

        assertThat(result.warnings()).singleElement().satisfies(w -> {
            assertThat(w.type()).isEqualTo(WarningType.SUGGESTION_UNAVAILABLE);
            assertThat(w.message()).isEqualTo("Suggestions failed: service unavailable");
        });
    }

    @Test
    void build_invalidSuggestion_isValidatedLikeAnyDirective() {
        DirectiveSuggester suggester = (code, patterns, framework, constraints) ->
            List.of(new DirectiveSuggestion(new Rename("identifier", "console", "logger"), 0.95, "bad"));
        AdaptationPlanBuilder builder = new AdaptationPlanBuilder(suggester, 1_000, 0.7, Set.of());

        PlanningResult result = builder.build(COMPONENT, TargetContext.empty(), Map.of());

        assertThat(result.plan().transformations()).isEmpty();
        assertThat(result.warnings()).extracting(AdaptationWarning::type)
            .containsExactly(WarningType.INVALID_DIRECTIVE);
    }

    @Test
    void constructor_nonPositiveTimeout_throws() {
        assertThatThrownBy(() -> new AdaptationPlanBuilder(null, 0, 0.7, Set.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void suggestion_confidenceOutOfRange_throws() {
        assertThatThrownBy(() -> new DirectiveSuggestion(new Rename("identifier", "a", "b"), 1.5, "x"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
