package com.codeadapt.core.catalog;

import com.codeadapt.core.analysis.PatternAnalyzer;
import com.codeadapt.core.ast.AstRewriter;
import com.codeadapt.core.ast.JavaScriptAst.*;
import com.codeadapt.core.model.Component;
import com.codeadapt.core.model.ConfigurableVariable;
import com.codeadapt.core.model.CustomizationMetadata;
import com.codeadapt.core.model.InjectionPoint;
import com.codeadapt.core.model.InjectionPosition;
import com.codeadapt.core.model.VariableType;
import com.codeadapt.core.parser.JavaScriptAstParser;
import com.codeadapt.core.util.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Discovers the customization metadata of a component from its source.
 *
 * <p>Discovery covers:
 * <ul>
 *   <li>Variables - top-level properties of object literals assigned to a
 *       {@code config}/{@code options}/{@code settings} variable, and {@code process.env.NAME}
 *       reads.</li>
 *   <li>Injection points - {@code injection-N}: the start and end of every named function
 *       declaration, the start of every class method, and every comment containing
 *       {@code @inject} or {@code INJECT}.</li>
 *   <li>Patterns - as reported by {@link PatternAnalyzer}.</li>
 *   <li>Dependencies - package names of imports, re-exports, {@code import()} and
 *       {@code require()}; relative and absolute paths are skipped.</li>
 *   <li>Framework - from well-known package names, then from {@code React.} or
 *       {@code Vue.} member access.</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Component cataloged = new ComponentCataloger().catalog(component);
 * cataloged.metadata().injectionPoints().forEach(p -> System.out.println(p.location()));
 * }</pre>
 */
public class ComponentCataloger {

    private static final Logger log = LoggerFactory.getLogger(ComponentCataloger.class);

    // Checked in order; the first package found decides.
    private static final Map<String, String> FRAMEWORK_PACKAGES = new LinkedHashMap<>();

    static {
        FRAMEWORK_PACKAGES.put("react", "react");
        FRAMEWORK_PACKAGES.put("react-dom", "react");
        FRAMEWORK_PACKAGES.put("vue", "vue");
        FRAMEWORK_PACKAGES.put("@angular/core", "angular");
        FRAMEWORK_PACKAGES.put("svelte", "svelte");
        FRAMEWORK_PACKAGES.put("express", "express");
        FRAMEWORK_PACKAGES.put("fastify", "fastify");
        FRAMEWORK_PACKAGES.put("next", "next");
        FRAMEWORK_PACKAGES.put("nuxt", "nuxt");
    }

    private final PatternAnalyzer analyzer;

    public ComponentCataloger() {
        this(new PatternAnalyzer());
    }

    public ComponentCataloger(PatternAnalyzer analyzer) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
    }

    /**
     * Returns the component with freshly discovered metadata.
     *
     * @throws com.codeadapt.core.parser.JavaScriptParseException if the source does not parse
     */
    public Component catalog(Component component) {
        Objects.requireNonNull(component, "component must not be null");
        CustomizationMetadata metadata = discover(JavaScriptAstParser.parse(component.source()));
        log.info("Cataloged component '{}': {} variables, {} injection points, {} dependencies",
            component.id(), metadata.variables().size(), metadata.injectionPoints().size(),
            metadata.dependencies().size());
        return component.withMetadata(metadata);
    }

    public CustomizationMetadata discover(String source) {
        return discover(JavaScriptAstParser.parse(source));
    }

    public CustomizationMetadata discover(Program program) {
        Objects.requireNonNull(program, "program must not be null");
        Discovery discovery = new Discovery();
        discovery.rewriteProgram(program);

        List<InjectionPoint> points = new ArrayList<>();
        for (PendingPoint pending : discovery.points) {
            points.add(pending.toInjectionPoint(points.size() + 1));
        }
        for (PendingPoint pending : discovery.markers) {
            points.add(pending.toInjectionPoint(points.size() + 1));
        }

        return new CustomizationMetadata(
            List.copyOf(discovery.variables.values()),
            points,
            analyzer.analyze(program).toDescriptors(),
            List.copyOf(discovery.dependencies),
            detectFramework(discovery));
    }

    private static String detectFramework(Discovery discovery) {
        for (Map.Entry<String, String> entry : FRAMEWORK_PACKAGES.entrySet()) {
            if (discovery.modules.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        if (discovery.globals.contains("React")) {
            return "react";
        }
        if (discovery.globals.contains("Vue")) {
            return "vue";
        }
        return null;
    }

    /**
     * Extracts the package name of a module specifier.
     *
     * <pre>{@code
     * lodash/fp      -> lodash
     * @scope/pkg/sub -> @scope/pkg
     * ./local        -> null
     * }</pre>
     */
    static String packageName(String module) {
        if (module == null || module.isEmpty() || module.startsWith(".") || module.startsWith("/")) {
            return null;
        }
        String[] parts = module.split("/");
        if (module.startsWith("@") && parts.length > 1) {
            return parts[0] + "/" + parts[1];
        }
        return parts[0];
    }

    static VariableType inferType(Expression value) {
        if (value instanceof Literal literal) {
            return switch (literal.kind()) {
                case NUMBER -> VariableType.NUMBER;
                case BOOLEAN -> VariableType.BOOLEAN;
                default -> VariableType.STRING;
            };
        }
        if (value instanceof ArrayExpression) {
            return VariableType.ARRAY;
        }
        if (value instanceof ObjectExpression) {
            return VariableType.OBJECT;
        }
        return VariableType.STRING;
    }

    static String defaultValue(Expression value) {
        if (value instanceof Literal literal) {
            return switch (literal.kind()) {
                case STRING -> literal.stringContent();
                case NUMBER, BOOLEAN -> literal.raw();
                default -> null;
            };
        }
        return null;
    }

    private record PendingPoint(String description, InjectionPosition kind, String location) {
        InjectionPoint toInjectionPoint(int number) {
            return new InjectionPoint("injection-" + number, description, kind, location);
        }
    }

    /**
     * Single walk collecting everything discovery needs.
     */
    private static final class Discovery extends AstRewriter {

        private final Map<String, ConfigurableVariable> variables = new LinkedHashMap<>();
        private final List<PendingPoint> points = new ArrayList<>();
        private final List<PendingPoint> markers = new ArrayList<>();
        private final Set<String> modules = new LinkedHashSet<>();
        private final Set<String> dependencies = new LinkedHashSet<>();
        private final Set<String> globals = new LinkedHashSet<>();

        private void module(String source) {
            if (source == null) {
                return;
            }
            modules.add(source);
            String name = packageName(source);
            if (name != null) {
                dependencies.add(name);
            }
        }

        @Override
        public Node visitImportDeclaration(ImportDeclaration importDeclaration) {
            module(importDeclaration.source());
            return importDeclaration;
        }

        @Override
        public Node visitExportListDeclaration(ExportListDeclaration exportListDeclaration) {
            module(exportListDeclaration.source());
            return exportListDeclaration;
        }

        @Override
        public Node visitExportAllDeclaration(ExportAllDeclaration exportAllDeclaration) {
            module(exportAllDeclaration.source());
            return exportAllDeclaration;
        }

        @Override
        public Node visitImportCall(ImportCall importCall) {
            if (importCall.source() instanceof Literal literal && literal.kind() == LiteralKind.STRING) {
                module(literal.stringContent());
            }
            return super.visitImportCall(importCall);
        }

        @Override
        public Node visitCallExpression(CallExpression callExpression) {
            if (callExpression.callee() instanceof Identifier callee
                && "require".equals(callee.name())
                && callExpression.arguments().size() == 1
                && callExpression.arguments().get(0) instanceof Literal literal
                && literal.kind() == LiteralKind.STRING) {
                module(literal.stringContent());
            }
            return super.visitCallExpression(callExpression);
        }

        @Override
        public Node visitMemberExpression(MemberExpression memberExpression) {
            if (memberExpression.object() instanceof Identifier object) {
                globals.add(object.name());
            }
            String env = environmentName(memberExpression);
            if (env != null) {
                variables.putIfAbsent(env,
                    new ConfigurableVariable(env, VariableType.ENV, "Environment variable: " + env, null));
            }
            return super.visitMemberExpression(memberExpression);
        }

        private static Expression unwrapAssertion(Expression expression) {
            return expression instanceof TypeAssertion assertion ? assertion.expression() : expression;
        }

        private static String environmentName(MemberExpression member) {
            if (!(member.object() instanceof MemberExpression inner)
                || !(inner.object() instanceof Identifier process)
                || !"process".equals(process.name())
                || !"env".equals(inner.property())) {
                return null;
            }
            if (member.property() != null) {
                return member.property();
            }
            if (member.index() instanceof Literal literal && literal.kind() == LiteralKind.STRING) {
                return literal.stringContent();
            }
            return null;
        }

        @Override
        public Node visitVariableDeclarator(VariableDeclarator variableDeclarator) {
            if (variableDeclarator.id().untyped() instanceof Identifier id
                && Identifiers.isConfigName(id.name())
                && unwrapAssertion(variableDeclarator.init()) instanceof ObjectExpression object) {
                for (ObjectMember member : object.properties()) {
                    if (member instanceof Property property && property.key().name() != null) {
                        String name = property.key().name();
                        variables.putIfAbsent(name, new ConfigurableVariable(
                            name,
                            inferType(property.value()),
                            "Configuration option: " + name,
                            defaultValue(property.value())));
                    }
                }
            }
            return super.visitVariableDeclarator(variableDeclarator);
        }

        @Override
        public Node visitFunctionDeclaration(FunctionDeclaration functionDeclaration) {
            if (functionDeclaration.id() != null) {
                String name = functionDeclaration.id().name();
                points.add(new PendingPoint("Before function " + name, InjectionPosition.BEFORE, "function:" + name + ":start"));
                points.add(new PendingPoint("After function " + name, InjectionPosition.AFTER, "function:" + name + ":end"));
            }
            return super.visitFunctionDeclaration(functionDeclaration);
        }

        @Override
        public Node visitMethodDefinition(MethodDefinition methodDefinition) {
            String name = methodDefinition.key().name();
            if (name != null && "method".equals(methodDefinition.kind())) {
                points.add(new PendingPoint("Before method " + name, InjectionPosition.BEFORE, "method:" + name + ":start"));
            }
            return super.visitMethodDefinition(methodDefinition);
        }

        @Override
        public Node visitComment(Comment comment) {
            String content = comment.content();
            if (content.contains("@inject") || content.contains("INJECT")) {
                String description = content.replace("@inject", "").replace("INJECT", "").trim();
                markers.add(new PendingPoint(description, InjectionPosition.REPLACE, "comment:" + content));
            }
            return comment;
        }
    }
}
