package io.rulekit.core.rules;

import io.rulekit.core.error.ValidationErrorCollection;
import io.rulekit.core.model.RuleContext;
import java.util.Objects;

/**
 * A single constraint over values of type {@code T}.
 *
 * <p>
 * Implementations must be immutable and thread-safe: the same rule instance is
 * shared by every rule set derived from the one it was added to and is
 * evaluated concurrently by the object engine.
 *
 * @param <T> the value type
 */
public interface Rule<T> {

    /**
     * Checks {@code value}.
     *
     * @param ctx   the evaluation context; errors take their path from it
     * @param value the value to check
     * @return the violations, {@link ValidationErrorCollection#empty()} when valid; never null
     */
    ValidationErrorCollection evaluate(RuleContext ctx, T value);

    /**
     * Returns true when this rule supersedes {@code existing}, in which case
     * {@code existing} is dropped from the chain this rule is added to. For
     * example a second minimum-length rule replaces the first.
     */
    default boolean conflictsWith(Rule<T> existing) {
        return false;
    }

    /** Builder-style description, e.g. {@code WithMinLen(3)}. */
    String describe();

    /**
     * Adapts a function into a rule. Function rules never conflict and
     * describe themselves as {@code WithRuleFunc(<function>)}.
     */
    static <T> Rule<T> of(RuleFunc<T> fn) {
        Objects.requireNonNull(fn, "fn must not be null");
        return new Rule<>() {
            @Override
            public ValidationErrorCollection evaluate(RuleContext ctx, T value) {
                ValidationErrorCollection errors = fn.evaluate(ctx, value);
                return errors != null ? errors : ValidationErrorCollection.empty();
            }

            @Override
            public String describe() {
                return "WithRuleFunc(<function>)";
            }

            @Override
            public String toString() {
                return describe();
            }
        };
    }
}
