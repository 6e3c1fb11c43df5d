package io.rulekit.core.rules;

import io.rulekit.core.error.ErrorCode;
import io.rulekit.core.error.ValidationError;
import io.rulekit.core.error.ValidationErrorCollection;
import io.rulekit.core.model.OutputRef;
import io.rulekit.core.model.RuleContext;
import java.util.Objects;

/**
 * Adapts a typed rule set to untyped values so it can be nested wherever a
 * {@code RuleSet<Object>} is expected. The inner rule set coerces; rules added
 * to the wrapper run against the coerced value afterwards.
 *
 * @param <T> the inner rule set's output type
 */
public final class WrapAny<T> implements RuleSet<Object> {

    private final RuleSet<T> inner;
    private final ConstraintChain<Object> chain;
    private final boolean required;
    private final boolean withNil;

    private WrapAny(RuleSet<T> inner, ConstraintChain<Object> chain, boolean required, boolean withNil) {
        this.inner = inner;
        this.chain = chain;
        this.required = required;
        this.withNil = withNil;
    }

    /** Wraps {@code inner}; the wrapper starts out required if {@code inner} is. */
    public static <T> WrapAny<T> of(RuleSet<T> inner) {
        Objects.requireNonNull(inner, "inner must not be null");
        return new WrapAny<>(inner, ConstraintChain.root("WrapAny"), inner.required(), false);
    }

    public RuleSet<T> inner() {
        return inner;
    }

    @Override
    public boolean required() {
        return required;
    }

    public WrapAny<T> withRequired() {
        return required ? this : new WrapAny<>(inner, chain.withLabel("WithRequired()"), true, withNil);
    }

    public WrapAny<T> withNil() {
        return withNil ? this : new WrapAny<>(inner, chain.withLabel("WithNil()"), required, true);
    }

    public WrapAny<T> withRule(Rule<Object> rule) {
        return new WrapAny<>(inner, chain.withRule(rule), required, withNil);
    }

    public WrapAny<T> withRuleFunc(RuleFunc<Object> fn) {
        return withRule(Rule.of(fn));
    }

    @Override
    public ValidationErrorCollection apply(RuleContext ctx, Object input, OutputRef<Object> output) {
        if (output == null) {
            return ValidationErrorCollection.of(
                    ValidationError.withMessage(ErrorCode.INTERNAL, ctx, "output must not be null"));
        }
        if (input == null && withNil) {
            output.set(null);
            return ValidationErrorCollection.empty();
        }
        OutputRef<T> typed = OutputRef.empty();
        ValidationErrorCollection errors = inner.apply(ctx, input, typed);
        if (!errors.isEmpty()) {
            return errors;
        }
        errors = chain.evaluate(ctx, typed.get());
        if (errors.isEmpty()) {
            output.set(typed.get());
        }
        return errors;
    }

    /** Runs the inner rule set's coercion and rules, then this wrapper's rules. */
    @Override
    public ValidationErrorCollection evaluate(RuleContext ctx, Object value) {
        return apply(ctx, value, OutputRef.empty());
    }

    @Override
    public RuleSet<Object> any() {
        return this;
    }

    @Override
    public String describe() {
        String base = inner.describe() + ".Any()";
        String own = chain.describe();
        return own.equals("WrapAny") ? base : base + own.substring("WrapAny".length());
    }

    @Override
    public String toString() {
        return describe();
    }
}
