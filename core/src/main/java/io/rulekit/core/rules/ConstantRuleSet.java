package io.rulekit.core.rules;

import io.rulekit.core.error.ErrorCode;
import io.rulekit.core.error.ValidationError;
import io.rulekit.core.error.ValidationErrorCollection;
import io.rulekit.core.model.OutputRef;
import io.rulekit.core.model.RuleContext;
import java.util.Objects;

/**
 * Accepts exactly one value. Mostly used as a key matcher: object rule sets
 * compare constant keys by equality and only constant keys can take part in
 * conditional dependencies.
 *
 * @param <T> the value type
 */
public final class ConstantRuleSet<T> implements RuleSet<T> {

    private final T value;
    private final boolean required;
    private final boolean withNil;

    private ConstantRuleSet(T value, boolean required, boolean withNil) {
        this.value = value;
        this.required = required;
        this.withNil = withNil;
    }

    public static <T> ConstantRuleSet<T> of(T value) {
        return new ConstantRuleSet<>(Objects.requireNonNull(value, "value must not be null"), false, false);
    }

    /** The constant. */
    public T value() {
        return value;
    }

    @Override
    public boolean required() {
        return required;
    }

    public ConstantRuleSet<T> withRequired() {
        return required ? this : new ConstantRuleSet<>(value, true, withNil);
    }

    public ConstantRuleSet<T> withNil() {
        return withNil ? this : new ConstantRuleSet<>(value, required, true);
    }

    @Override
    public ValidationErrorCollection apply(RuleContext ctx, Object input, OutputRef<T> output) {
        if (output == null) {
            return ValidationErrorCollection.of(
                    ValidationError.withMessage(ErrorCode.INTERNAL, ctx, "output must not be null"));
        }
        if (input == null) {
            if (withNil) {
                output.set(null);
                return ValidationErrorCollection.empty();
            }
            return ValidationErrorCollection.of(ValidationError.of(ErrorCode.NULL, ctx));
        }
        if (!value.getClass().isInstance(input)) {
            return ValidationErrorCollection.of(
                    ValidationError.of(ErrorCode.TYPE, ctx, value.getClass().getSimpleName(), ValueKinds.of(input)));
        }
        @SuppressWarnings("unchecked")
        T typed = (T) input;
        ValidationErrorCollection errors = evaluate(ctx, typed);
        if (errors.isEmpty()) {
            output.set(typed);
        }
        return errors;
    }

    @Override
    public ValidationErrorCollection evaluate(RuleContext ctx, T candidate) {
        if (!value.equals(candidate)) {
            return ValidationErrorCollection.of(
                    ValidationError.withMessage(ErrorCode.PATTERN, ctx, "value does not match"));
        }
        return ValidationErrorCollection.empty();
    }

    /** A constant supersedes any other rule. */
    @Override
    public boolean conflictsWith(Rule<T> existing) {
        return true;
    }

    @Override
    public RuleSet<Object> any() {
        return WrapAny.of(this);
    }

    @Override
    public String describe() {
        String str = "ConstantRuleSet(" + value + ")";
        return required ? str + ".WithRequired()" : str;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConstantRuleSet<?> that)) return false;
        return required == that.required && withNil == that.withNil && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, required, withNil);
    }

    @Override
    public String toString() {
        return describe();
    }
}
