package io.rulekit.core.rules;

import io.rulekit.core.error.ValidationErrorCollection;
import io.rulekit.core.error.ValidationException;
import io.rulekit.core.model.OutputRef;
import io.rulekit.core.model.RuleContext;

/**
 * A composable, immutable description of coercion plus constraints for one
 * value type.
 *
 * @param <T> the coerced output type
 */
public interface RuleSet<T> extends Rule<T> {

    /**
     * Coerces {@code input} to {@code T}, evaluates every rule and, when valid,
     * writes the result through {@code output}.
     *
     * @param ctx    the evaluation context
     * @param input  the untyped input
     * @param output receives the coerced value; a null holder is an {@code INTERNAL} error
     * @return the violations, empty when valid; never null
     */
    ValidationErrorCollection apply(RuleContext ctx, Object input, OutputRef<T> output);

    /** True if the value may not be omitted when nested in an object. */
    boolean required();

    /** Adapts this rule set to untyped values for nesting. */
    RuleSet<Object> any();

    /** Validates against a fresh background context. */
    default T validate(Object input) {
        return validate(RuleContext.background(), input);
    }

    /**
     * Applies this rule set and returns the coerced value.
     *
     * @throws ValidationException if any violation is found
     */
    default T validate(RuleContext ctx, Object input) {
        OutputRef<T> output = OutputRef.empty();
        ValidationErrorCollection errors = apply(ctx, input, output);
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return output.get();
    }
}
