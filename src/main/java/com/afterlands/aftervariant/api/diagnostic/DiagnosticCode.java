package com.afterlands.aftervariant.api.diagnostic;

/**
 * Kinds of degradation the engine reports instead of failing.
 */
public enum DiagnosticCode {

    /** Declaration text matched neither {@code input} nor {@code local}. */
    INVALID_DECLARATION,

    /** Match key clause without {@code =}, or with an empty selector or value. */
    INVALID_PATTERN_KEY,

    /** Plural transform applied to a value that is not a number. */
    NON_NUMERIC_PLURAL_SOURCE,

    /** No match entry was satisfied; the first entry was used instead. */
    NO_MATCH,

    /** Match table missing or not an ordered key to template structure. */
    INVALID_STRUCTURE,

    /** Text looked like an encoded variant but could not be decoded. */
    UNPARSEABLE_VARIANT
}
