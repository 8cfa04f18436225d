package com.codeadapt.core.util;

import com.codeadapt.core.model.NamingConvention;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Utility methods for JavaScript identifier names.
 *
 * <p>The builtin list is a heuristic: it names globals, runtime objects and framework
 * entry points that renames and naming conversions must never touch. A local variable that
 * shadows one of these names is skipped as well.
 */
public final class Identifiers {

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_$][A-Za-z0-9_$]*$");
    private static final Pattern SINGLE_WORD_PASCAL = Pattern.compile("^[A-Z][a-z]*$");
    private static final Pattern CONFIG_NAME = Pattern.compile("config|options|settings", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEPARATOR = Pattern.compile("[\\s_\\-]+");
    private static final Pattern CASE_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])|(?<=[A-Z])(?=[A-Z][a-z])");

    private static final Set<String> RESERVED_WORDS = Set.of(
        "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete",
        "do", "else", "enum", "export", "extends", "false", "finally", "for", "function", "if",
        "import", "in", "instanceof", "new", "null", "return", "super", "switch", "this", "throw",
        "true", "try", "typeof", "var", "void", "while", "with", "yield", "let", "static",
        "implements", "interface", "package", "private", "protected", "public", "await", "async"
    );

    private static final Set<String> BUILTINS = Set.of(
        // JavaScript globals
        "console", "window", "document", "global", "globalThis", "process", "Buffer",
        "Array", "Object", "String", "Number", "Boolean", "Date", "RegExp", "Promise", "Symbol",
        "Map", "Set", "WeakMap", "Error", "TypeError", "ReferenceError", "SyntaxError", "Math", "JSON",
        "parseInt", "parseFloat", "isNaN", "isFinite", "setTimeout", "setInterval",
        "clearTimeout", "clearInterval", "encodeURIComponent", "decodeURIComponent",
        "fetch", "localStorage", "sessionStorage", "navigator", "location", "history",
        // React
        "React", "Component", "useState", "useEffect", "useContext",
        // Vue
        "Vue", "computed", "ref", "reactive", "watch",
        // Node.js
        "require", "module", "exports", "__dirname", "__filename",
        // TypeScript
        "any", "unknown", "never", "void", "undefined", "null"
    );

    private Identifiers() {
        // Utility class - no instantiation
    }

    public static boolean isIdentifier(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    public static boolean isReservedWord(String name) {
        return RESERVED_WORDS.contains(name);
    }

    /**
     * Returns true if the name is a known global or framework name.
     */
    public static boolean isBuiltin(String name) {
        return BUILTINS.contains(name);
    }

    /**
     * Returns true if a variable with this name holds configuration, i.e. the name contains
     * {@code config}, {@code options} or {@code settings} in any case.
     */
    public static boolean isConfigName(String name) {
        return name != null && CONFIG_NAME.matcher(name).find();
    }

    /**
     * Returns true if the name is a single capitalized word such as {@code Button}.
     * Such names are component or class names and are left alone by naming conversions.
     */
    public static boolean isSingleWordPascal(String name) {
        return SINGLE_WORD_PASCAL.matcher(name).matches();
    }

    /**
     * Splits a name into lower-case words at {@code _}, {@code -}, whitespace or case boundaries.
     *
     * <pre>{@code
     * split("fetchUserData")  = [fetch, user, data]
     * split("fetch_user_data") = [fetch, user, data]
     * split("parseHTTPHeader") = [parse, http, header]
     * split("Login Form")      = [login, form]
     * }</pre>
     */
    public static List<String> split(String name) {
        List<String> words = new ArrayList<>();
        for (String segment : SEPARATOR.split(name.trim())) {
            for (String part : CASE_BOUNDARY.split(segment)) {
                if (!part.isEmpty()) {
                    words.add(part.toLowerCase(Locale.ROOT));
                }
            }
        }
        return words;
    }

    /**
     * Converts a name from one convention to another.
     *
     * <p>Names already shaped like {@code to}, or not shaped like {@code from}, are returned
     * unchanged, so converting twice gives the same result as converting once.
     */
    public static String convert(String name, NamingConvention from, NamingConvention to) {
        if (to.matches(name) || !from.matches(name)) {
            return name;
        }
        List<String> words = split(name);
        if (words.isEmpty()) {
            return name;
        }
        return to.join(words);
    }
}
