package com.codeadapt.core.transform;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed form of an injection point location.
 *
 * <pre>{@code
 * function:login        function:login:start        function:login:end
 * method:render         method:render:start         method:render:end
 * comment:INJECT_HERE
 * }</pre>
 *
 * <p>The {@code :start} / {@code :end} suffix documents where the point sits; placement is
 * decided by the inject directive's position.
 *
 * @param kind what the location refers to
 * @param name function or method name, or comment marker
 * @param anchor {@code start}, {@code end}, or null
 */
record InjectionLocation(Kind kind, String name, String anchor) {

    enum Kind {
        FUNCTION,
        METHOD,
        COMMENT
    }

    InjectionLocation {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Parses a location expression.
     *
     * @return the location, or empty if the expression is malformed
     */
    static Optional<InjectionLocation> parse(String location) {
        if (location == null) {
            return Optional.empty();
        }
        int colon = location.indexOf(':');
        if (colon <= 0 || colon == location.length() - 1) {
            return Optional.empty();
        }
        String prefix = location.substring(0, colon).trim().toLowerCase(Locale.ROOT);
        String rest = location.substring(colon + 1).trim();
        if ("comment".equals(prefix)) {
            return Optional.of(new InjectionLocation(Kind.COMMENT, rest, null));
        }
        Kind kind = switch (prefix) {
            case "function" -> Kind.FUNCTION;
            case "method" -> Kind.METHOD;
            default -> null;
        };
        if (kind == null) {
            return Optional.empty();
        }
        String name = rest;
        String anchor = null;
        int suffix = rest.lastIndexOf(':');
        if (suffix > 0) {
            name = rest.substring(0, suffix);
            anchor = rest.substring(suffix + 1);
            if (!"start".equals(anchor) && !"end".equals(anchor)) {
                return Optional.empty();
            }
        }
        return Optional.of(new InjectionLocation(kind, name, anchor));
    }
}
