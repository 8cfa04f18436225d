package com.codeadapt.core.model;

/**
 * Conditions under which a directive or a pipeline step degrades instead of failing.
 */
public enum WarningType {
    /** An inject directive names an unknown point, or its location matches nothing. */
    UNRESOLVED_INJECTION_POINT,
    /** A configure directive names a variable the component does not declare or contain. */
    UNKNOWN_CONFIGURE_VARIABLE,
    /** A directive failed validation at plan construction and was dropped. */
    INVALID_DIRECTIVE,
    /** A pattern conversion has no complete algorithm; applied partially or not at all. */
    UNSUPPORTED_PATTERN_CONVERSION,
    /** Formatting failed; the unformatted generator output was kept. */
    FORMAT_ERROR,
    /** A directive matched nothing in the tree. */
    NO_MATCH,
    /** The directive suggester failed or timed out. */
    SUGGESTION_UNAVAILABLE
}
