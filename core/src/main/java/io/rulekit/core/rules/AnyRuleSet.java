package io.rulekit.core.rules;

import io.rulekit.core.error.ErrorCode;
import io.rulekit.core.error.ValidationError;
import io.rulekit.core.error.ValidationErrorCollection;
import io.rulekit.core.model.OutputRef;
import io.rulekit.core.model.RuleContext;

/**
 * Accepts any value and passes it through unaltered. Custom rules added with
 * {@link #withRule} still run.
 */
public final class AnyRuleSet implements RuleSet<Object> {

    private static final AnyRuleSet BASE = new AnyRuleSet(ConstraintChain.root("AnyRuleSet"), false, false, false);

    private final ConstraintChain<Object> chain;
    private final boolean required;
    private final boolean forbidden;
    private final boolean withNil;

    private AnyRuleSet(ConstraintChain<Object> chain, boolean required, boolean forbidden, boolean withNil) {
        this.chain = chain;
        this.required = required;
        this.forbidden = forbidden;
        this.withNil = withNil;
    }

    public static AnyRuleSet anything() {
        return BASE;
    }

    @Override
    public boolean required() {
        return required;
    }

    public AnyRuleSet withRequired() {
        return required ? this : new AnyRuleSet(chain.withLabel("WithRequired()"), true, forbidden, withNil);
    }

    /** Only absent or null values are accepted. */
    public AnyRuleSet withForbidden() {
        return forbidden ? this : new AnyRuleSet(chain.withLabel("WithForbidden()"), required, true, withNil);
    }

    public AnyRuleSet withNil() {
        return withNil ? this : new AnyRuleSet(chain.withLabel("WithNil()"), required, forbidden, true);
    }

    public AnyRuleSet withRule(Rule<Object> rule) {
        return new AnyRuleSet(chain.withRule(rule), required, forbidden, withNil);
    }

    public AnyRuleSet withRuleFunc(RuleFunc<Object> fn) {
        return withRule(Rule.of(fn));
    }

    @Override
    public ValidationErrorCollection apply(RuleContext ctx, Object input, OutputRef<Object> output) {
        if (output == null) {
            return ValidationErrorCollection.of(
                    ValidationError.withMessage(ErrorCode.INTERNAL, ctx, "output must not be null"));
        }
        if (input == null && (withNil || forbidden)) {
            output.set(null);
            return ValidationErrorCollection.empty();
        }
        if (input == null) {
            return ValidationErrorCollection.of(ValidationError.of(ErrorCode.NULL, ctx));
        }
        ValidationErrorCollection errors = evaluate(ctx, input);
        if (errors.isEmpty()) {
            output.set(input);
        }
        return errors;
    }

    @Override
    public ValidationErrorCollection evaluate(RuleContext ctx, Object value) {
        if (forbidden) {
            return ValidationErrorCollection.of(ValidationError.of(ErrorCode.FORBIDDEN, ctx));
        }
        return chain.evaluate(ctx, value);
    }

    @Override
    public RuleSet<Object> any() {
        return this;
    }

    @Override
    public String describe() {
        return chain.describe();
    }

    @Override
    public String toString() {
        return describe();
    }
}
