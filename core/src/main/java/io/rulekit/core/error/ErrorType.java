package io.rulekit.core.error;

/** Broad classification of an {@link ErrorCode}. */
public enum ErrorType {
    /** The input value is at fault. */
    VALIDATION,
    /** The rule set, its configuration or the environment is at fault. Never caused by user input. */
    INTERNAL
}
