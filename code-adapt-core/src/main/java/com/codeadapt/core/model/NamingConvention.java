package com.codeadapt.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Identifier naming conventions.
 *
 * <p>Each convention except {@link #UNDETERMINED} has a shape that identifiers are
 * classified against, and knows how to join words into an identifier of that shape.
 * Declaration order is the tie-break priority used by the pattern analyzer.
 */
public enum NamingConvention {
    CAMEL_CASE("camelCase", "^[a-z][a-zA-Z0-9]*$"),
    SNAKE_CASE("snake_case", "^[a-z][a-z0-9]*(_[a-z0-9]+)+$"),
    PASCAL_CASE("PascalCase", "^[A-Z][a-zA-Z0-9]*$"),
    KEBAB_CASE("kebab-case", "^[a-z][a-z0-9]*(-[a-z0-9]+)+$"),
    UNDETERMINED("undetermined", null);

    private final String id;
    private final Pattern shape;

    NamingConvention(String id, String shape) {
        this.id = id;
        this.shape = shape != null ? Pattern.compile(shape) : null;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Returns true if the name has this convention's shape.
     */
    public boolean matches(String name) {
        return shape != null && name != null && shape.matcher(name).matches();
    }

    /**
     * Joins lower-case words into a name of this convention.
     *
     * @throws IllegalStateException for {@link #UNDETERMINED}
     */
    public String join(List<String> words) {
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < words.size(); i++) {
            String word = words.get(i).toLowerCase(Locale.ROOT);
            switch (this) {
                case CAMEL_CASE -> result.append(i == 0 ? word : capitalize(word));
                case PASCAL_CASE -> result.append(capitalize(word));
                case SNAKE_CASE -> result.append(i == 0 ? "" : "_").append(word);
                case KEBAB_CASE -> result.append(i == 0 ? "" : "-").append(word);
                default -> throw new IllegalStateException("Cannot join words for " + id);
            }
        }
        return result.toString();
    }

    private static String capitalize(String word) {
        return word.isEmpty() ? word : Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }

    @JsonCreator
    public static NamingConvention fromId(String id) {
        if (id == null) {
            return null;
        }
        for (NamingConvention value : values()) {
            if (value.id.equalsIgnoreCase(id.trim())) {
                return value;
            }
        }
        return null;
    }
}
