package io.rulekit.core.error;

import java.util.Objects;

/**
 * Thrown by the convenience {@code validate} methods when the input fails
 * validation. Carries the full error collection.
 */
public final class ValidationException extends RuleException {

    private static final long serialVersionUID = 1L;

    private final transient ValidationErrorCollection errors;

    public ValidationException(ValidationErrorCollection errors) {
        super(Objects.requireNonNull(errors, "errors must not be null").toString(), Phase.EVALUATION);
        this.errors = errors;
    }

    public ValidationErrorCollection errors() {
        return errors;
    }
}
