package com.codeadapt.core.adapter;

import com.codeadapt.core.ast.JavaScriptAst.Program;
import com.codeadapt.core.catalog.ComponentCataloger;
import com.codeadapt.core.config.AdapterConfig;
import com.codeadapt.core.directive.DirectiveValidator;
import com.codeadapt.core.directive.TransformationDirective;
import com.codeadapt.core.directive.ValidationResult;
import com.codeadapt.core.generator.CodeFormatter;
import com.codeadapt.core.generator.FormatException;
import com.codeadapt.core.generator.JavaScriptCodeGenerator;
import com.codeadapt.core.generator.StyleConfig;
import com.codeadapt.core.model.AdaptationPlan;
import com.codeadapt.core.model.AdaptationWarning;
import com.codeadapt.core.model.AdaptedResult;
import com.codeadapt.core.model.Component;
import com.codeadapt.core.model.CustomizationMetadata;
import com.codeadapt.core.model.ExportStyle;
import com.codeadapt.core.model.GeneratedFile;
import com.codeadapt.core.model.Instructions;
import com.codeadapt.core.model.NamingConvention;
import com.codeadapt.core.model.TargetContext;
import com.codeadapt.core.model.WarningType;
import com.codeadapt.core.parser.JavaScriptAstParser;
import com.codeadapt.core.plan.AdaptationPlanBuilder;
import com.codeadapt.core.plan.DirectiveSuggester;
import com.codeadapt.core.plan.PlanningResult;
import com.codeadapt.core.transform.AstTransformer;
import com.codeadapt.core.transform.TransformResult;
import com.codeadapt.core.util.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Adapts components to a target project.
 *
 * <p>Pipeline: catalog (when the component has no metadata yet), parse, plan, transform,
 * generate, format, assemble. Only unparsable source fails the adaptation; every other
 * problem is reported as a warning on the result.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ComponentAdapter adapter = new ComponentAdapter(ConfigLoader.load(Paths.get("codeadapt.yml")));
 * AdaptedResult result = adapter.adapt(component, target, Map.of("apiUrl", "'https://api.example.com'"));
 * Files.writeString(outputDir.resolve(result.filename()), result.files().get(0).content());
 * }</pre>
 *
 * <p>Adapters keep no per-request state and can be shared between threads.
 */
public class ComponentAdapter {

    private static final Logger log = LoggerFactory.getLogger(ComponentAdapter.class);

    private static final List<String> FORMATTABLE_EXTENSIONS = List.of(".js", ".mjs", ".cjs", ".ts", ".jsx", ".tsx");

    private final AdapterConfig config;
    private final ComponentCataloger cataloger;
    private final AdaptationPlanBuilder planBuilder;
    private final AstTransformer transformer;

    public ComponentAdapter() {
        this(AdapterConfig.defaults());
    }

    public ComponentAdapter(AdapterConfig config) {
        this(config, null);
    }

    /**
     * @param config adapter configuration
     * @param suggester suggestion source, or null; only used when suggestions are enabled
     */
    public ComponentAdapter(AdapterConfig config, DirectiveSuggester suggester) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        AdapterConfig.SuggestionConfig suggestions = config.suggestions();
        this.cataloger = new ComponentCataloger();
        this.planBuilder = new AdaptationPlanBuilder(
            suggestions.enabled() ? suggester : null,
            suggestions.timeoutMillis(),
            suggestions.confidenceThreshold(),
            config.naming().extraBuiltinSet());
        this.transformer = new AstTransformer(config.naming().extraBuiltinSet());
    }

    /**
     * Plans and applies an adaptation.
     *
     * @param component component to adapt
     * @param target target project conventions
     * @param customizations variable values keyed by variable name, may be null
     * @return adapted result
     * @throws com.codeadapt.core.parser.JavaScriptParseException if the component source does not parse
     */
    public AdaptedResult adapt(Component component, TargetContext target, Map<String, String> customizations) {
        Component cataloged = ensureCataloged(component);
        PlanningResult planning = planBuilder.build(cataloged, target, customizations);
        return apply(cataloged, planning.plan(), target, planning.setupSteps(), planning.warnings());
    }

    /**
     * Plans an adaptation without applying it.
     */
    public PlanningResult plan(Component component, TargetContext target, Map<String, String> customizations) {
        return planBuilder.build(ensureCataloged(component), target, customizations);
    }

    /**
     * Applies an existing plan. The plan is validated again against the component.
     */
    public AdaptedResult applyPlan(Component component, AdaptationPlan plan, TargetContext target) {
        Objects.requireNonNull(plan, "plan must not be null");
        Component cataloged = ensureCataloged(component);
        List<AdaptationWarning> warnings = new ArrayList<>();
        AdaptationPlan validated = revalidate(cataloged, plan, warnings);
        return apply(cataloged, validated, target, List.of(), warnings);
    }

    private AdaptationPlan revalidate(Component component, AdaptationPlan plan, List<AdaptationWarning> warnings) {
        ValidationResult validation = new DirectiveValidator(component.metadata(), config.naming().extraBuiltinSet())
            .validate(plan.transformations());
        warnings.addAll(validation.warnings());
        return new AdaptationPlan(plan.componentId(), validation.directives(), plan.additions());
    }

    private Component ensureCataloged(Component component) {
        Objects.requireNonNull(component, "component must not be null");
        if (component.metadata().equals(CustomizationMetadata.empty())) {
            return cataloger.catalog(component);
        }
        return component;
    }

    private AdaptedResult apply(Component component, AdaptationPlan plan, TargetContext target,
                                List<String> setupSteps, List<AdaptationWarning> planWarnings) {
        TargetContext context = target != null ? target : TargetContext.empty();
        log.info("Adapting component '{}' with {} transformations", component.id(), plan.transformations().size());

        Program program = JavaScriptAstParser.parse(component.source());
        TransformResult transformed = transformer.apply(program, plan.transformations(), component.metadata());

        List<AdaptationWarning> warnings = new ArrayList<>(planWarnings);
        warnings.addAll(transformed.warnings());

        StyleConfig style = context.style() != null ? context.style() : config.style();
        String generated = new JavaScriptCodeGenerator().generate(transformed.program());
        String code = format(generated, style, "main component", warnings);

        String filename = filename(component, context);
        String attribution = attribution(component);
        List<GeneratedFile> files = new ArrayList<>();
        files.add(new GeneratedFile(filename, attribution.isEmpty() ? code : attribution + "\n" + code, "Main component file"));
        for (GeneratedFile addition : plan.additions()) {
            String content = isFormattable(addition.relativePath())
                ? format(addition.content(), style, addition.relativePath(), warnings)
                : addition.content();
            files.add(new GeneratedFile(addition.relativePath(), content, addition.description()));
        }

        Instructions instructions = instructions(component, plan, context, setupSteps, filename);
        log.info("Adapted component '{}' into {} with {} warnings", component.id(), filename, warnings.size());
        return new AdaptedResult(component.metadata(), code, filename, files, instructions, attribution, plan, warnings);
    }

    private String format(String code, StyleConfig style, String what, List<AdaptationWarning> warnings) {
        if (!config.format().enabled()) {
            return code;
        }
        try {
            return new CodeFormatter(style).format(code);
        } catch (FormatException e) {
            log.warn("Formatting {} failed, keeping unformatted code: {}", what, e.getMessage());
            warnings.add(new AdaptationWarning(WarningType.FORMAT_ERROR, "Could not format " + what + ": " + e.getMessage()));
            return code;
        }
    }

    private static boolean isFormattable(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        return FORMATTABLE_EXTENSIONS.stream().anyMatch(lower::endsWith);
    }

    /**
     * Builds the file name: the component name in the target naming convention (kebab-case
     * when the target has none) with a {@code .ts} or {@code .js} extension.
     */
    static String filename(Component component, TargetContext target) {
        NamingConvention convention = target.namingConvention();
        if (convention == null || convention == NamingConvention.UNDETERMINED) {
            convention = NamingConvention.KEBAB_CASE;
        }
        List<String> words = Identifiers.split(component.name());
        String base = words.isEmpty() ? component.id() : convention.join(words);
        return base + (target.typescript() ? ".ts" : ".js");
    }

    static String attribution(Component component) {
        if (component.repository() == null && component.url() == null) {
            return "";
        }
        StringBuilder header = new StringBuilder("// Adapted from ")
            .append(component.repository() != null ? component.repository() : component.url());
        if (component.repository() != null && component.url() != null) {
            header.append(" (").append(component.url()).append(')');
        }
        header.append('\n');
        if (component.license() != null) {
            header.append("// License: ").append(component.license()).append('\n');
        }
        if (component.commit() != null) {
            header.append("// Original commit: ").append(component.commit()).append('\n');
        }
        return header.toString();
    }

    static Instructions instructions(Component component, AdaptationPlan plan, TargetContext target,
                                     List<String> setupSteps, String filename) {
        List<String> install = new ArrayList<>();
        String packageManager = target.packageManager() != null ? target.packageManager() : "npm";
        String installCommand = "npm".equals(packageManager) ? "npm install" : packageManager + " add";
        List<String> missing = component.metadata().dependencies().stream()
            .filter(dependency -> !target.installedDependencies().contains(dependency))
            .toList();
        if (!missing.isEmpty()) {
            install.add(installCommand + " " + String.join(" ", missing));
        }

        List<String> setup = new ArrayList<>();
        for (GeneratedFile addition : plan.additions()) {
            String description = addition.description() != null ? addition.description().toLowerCase(Locale.ROOT) : "";
            if (description.contains("config")) {
                setup.add("Configure settings in " + addition.relativePath());
            } else if (description.contains("env")) {
                setup.add("Set environment variables as shown in " + addition.relativePath());
            }
        }
        setup.addAll(setupSteps);
        boolean replacesImports = plan.transformations().stream()
            .anyMatch(directive -> directive instanceof TransformationDirective.ReplaceImport);
        if (replacesImports && target.framework() != null) {
            setup.add("Ensure " + target.framework() + " is properly configured");
        }

        return new Instructions(install, setup, usage(component.name(), target.exportStyle(), filename));
    }

    static String usage(String componentName, ExportStyle exportStyle, String filename) {
        String name = Identifiers.isIdentifier(componentName)
            ? componentName
            : NamingConvention.PASCAL_CASE.join(Identifiers.split(componentName));
        String module = "./" + filename.substring(0, filename.lastIndexOf('.'));
        String importLine;
        if (exportStyle == ExportStyle.DEFAULT) {
            importLine = "import " + name + " from '" + module + "';";
        } else if (exportStyle == ExportStyle.COMMONJS) {
            importLine = "const { " + name + " } = require('" + module + "');";
        } else {
            importLine = "import { " + name + " } from '" + module + "';";
        }
        return importLine + "\n\n// Use the component\n" + name + "();";
    }
}
