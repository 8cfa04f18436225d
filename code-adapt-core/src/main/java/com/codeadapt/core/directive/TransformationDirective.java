package com.codeadapt.core.directive;

import com.codeadapt.core.model.ImportStyle;
import com.codeadapt.core.model.InjectionPosition;
import com.codeadapt.core.model.PatternType;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One structural edit of an adaptation plan.
 *
 * <p>The set of directives is closed: {@link Rename}, {@link ReplaceImport}, {@link Inject},
 * {@link PatternChange} and {@link Configure}. Dispatch goes through
 * {@link DirectiveVisitor}, so adding a directive type breaks every visitor at compile time.
 *
 * <p>Directives are plain values. They are checked once by {@link DirectiveValidator} when
 * a plan is built; transformation passes assume the directives they receive are valid.
 *
 * <p><b>JSON form:</b>
 * <pre>{@code
 * { "type": "rename", "target": "identifier", "from": "fetchData", "to": "loadData" }
 * { "type": "replace-import", "from": "axios", "to": "ky", "importStyle": "named" }
 * { "type": "inject", "pointId": "after-login-success", "code": "track();", "position": "after" }
 * { "type": "pattern", "pattern": "naming", "from": "camelCase", "to": "snake_case" }
 * { "type": "configure", "variable": "apiKey", "value": "'xyz'" }
 * }</pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TransformationDirective.Rename.class, name = "rename"),
    @JsonSubTypes.Type(value = TransformationDirective.ReplaceImport.class, name = "replace-import"),
    @JsonSubTypes.Type(value = TransformationDirective.Inject.class, name = "inject"),
    @JsonSubTypes.Type(value = TransformationDirective.PatternChange.class, name = "pattern"),
    @JsonSubTypes.Type(value = TransformationDirective.Configure.class, name = "configure")
})
public interface TransformationDirective {

    <R> R accept(DirectiveVisitor<R> visitor);

    /**
     * Short description used in log lines and warnings.
     */
    String describe();

    /**
     * Renames a binding and its references.
     *
     * @param target kind of symbol being renamed, informational only
     * @param from current name
     * @param to new name
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Rename(String target, String from, String to) implements TransformationDirective {
        @Override
        public <R> R accept(DirectiveVisitor<R> visitor) {
            return visitor.visitRename(this);
        }

        @Override
        public String describe() {
            return "rename " + from + " -> " + to;
        }
    }

    /**
     * Points imports of one module at another.
     *
     * @param from module name to replace
     * @param to replacement module name
     * @param importStyle style to rewrite matching imports to, or null to keep them
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ReplaceImport(String from, String to, ImportStyle importStyle) implements TransformationDirective {
        @Override
        public <R> R accept(DirectiveVisitor<R> visitor) {
            return visitor.visitReplaceImport(this);
        }

        @Override
        public String describe() {
            return "replace-import " + from + " -> " + to;
        }
    }

    /**
     * Splices code at an injection point.
     *
     * @param pointId id of an injection point of the component
     * @param code statements to insert
     * @param position placement; null means the injection point's kind
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Inject(@JsonAlias("point") String pointId, String code, InjectionPosition position) implements TransformationDirective {
        @Override
        public <R> R accept(DirectiveVisitor<R> visitor) {
            return visitor.visitInject(this);
        }

        @Override
        public String describe() {
            return "inject at " + pointId;
        }

        public Inject withPosition(InjectionPosition newPosition) {
            return new Inject(pointId, code, newPosition);
        }
    }

    /**
     * Converts a stylistic pattern.
     *
     * @param pattern pattern kind, null when the kind is not recognized
     * @param from current value in the pattern's vocabulary
     * @param to target value in the pattern's vocabulary
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record PatternChange(PatternType pattern, String from, String to) implements TransformationDirective {
        @Override
        public <R> R accept(DirectiveVisitor<R> visitor) {
            return visitor.visitPatternChange(this);
        }

        @Override
        public String describe() {
            return "pattern " + (pattern != null ? pattern.id() : "?") + " " + from + " -> " + to;
        }

        @JsonIgnore
        public boolean isNoOp() {
            return from != null && from.equals(to);
        }
    }

    /**
     * Replaces the value of a configuration property.
     *
     * @param variable property name
     * @param value new value as source text; text that is not an expression becomes a string
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Configure(String variable, String value) implements TransformationDirective {
        @Override
        public <R> R accept(DirectiveVisitor<R> visitor) {
            return visitor.visitConfigure(this);
        }

        @Override
        public String describe() {
            return "configure " + variable;
        }
    }
}
