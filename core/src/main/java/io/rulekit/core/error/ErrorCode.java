package io.rulekit.core.error;

/**
 * Stable error codes. Callers should switch on the code rather than compare messages.
 *
 * <p>
 * {@link #REQUIRED}, {@link #UNEXPECTED}, {@link #TIMEOUT}, {@link #CANCELLED} and
 * {@link #INTERNAL} are raised by the object engine itself; the remaining codes
 * belong to the leaf rule sets.
 */
public enum ErrorCode {
    UNKNOWN(ErrorType.INTERNAL, "unknown error", "an unknown error occurred"),
    INTERNAL(ErrorType.INTERNAL, "internal error", "an internal error occurred"),
    TIMEOUT(ErrorType.INTERNAL, "timeout", "validation timed out before completing"),
    CANCELLED(ErrorType.INTERNAL, "cancelled", "validation was cancelled"),
    TYPE(ErrorType.VALIDATION, "invalid type", "expected %s but got %s"),
    RANGE(ErrorType.VALIDATION, "out of range", "value is out of range for %s"),
    REQUIRED(ErrorType.VALIDATION, "required", "field is required"),
    NULL(ErrorType.VALIDATION, "null not allowed", "value cannot be null"),
    UNEXPECTED(ErrorType.VALIDATION, "unexpected", "unexpected field"),
    MIN(ErrorType.VALIDATION, "below minimum", "must be at least %s"),
    MAX(ErrorType.VALIDATION, "above maximum", "must be at most %s"),
    MIN_LEN(ErrorType.VALIDATION, "too short", "length must be at least %s"),
    MAX_LEN(ErrorType.VALIDATION, "too long", "length must be at most %s"),
    PATTERN(ErrorType.VALIDATION, "invalid format", "value does not match the required format"),
    FORBIDDEN(ErrorType.VALIDATION, "forbidden", "value is forbidden"),
    NOT_ALLOWED(ErrorType.VALIDATION, "not allowed", "value is not one of the allowed options");

    private final ErrorType type;
    private final String shortMessage;
    private final String pattern;

    ErrorCode(ErrorType type, String shortMessage, String pattern) {
        this.type = type;
        this.shortMessage = shortMessage;
        this.pattern = pattern;
    }

    public ErrorType type() {
        return type;
    }

    /** Brief constant description, suitable for API responses. */
    public String shortMessage() {
        return shortMessage;
    }

    /** {@link String#format} pattern for the long message. */
    public String pattern() {
        return pattern;
    }
}
