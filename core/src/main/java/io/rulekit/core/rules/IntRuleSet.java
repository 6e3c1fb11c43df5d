package io.rulekit.core.rules;

import io.rulekit.core.error.ErrorCode;
import io.rulekit.core.error.ValidationError;
import io.rulekit.core.error.ValidationErrorCollection;
import io.rulekit.core.model.OutputRef;
import io.rulekit.core.model.RuleContext;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Rule set for 32-bit integers.
 *
 * <p>
 * Any integral number converts if it fits; floating point values convert only
 * when they have no fractional part. Values that do not fit produce a
 * {@code RANGE} error. Decimal strings are parsed unless the set is
 * {@linkplain #withStrict() strict}.
 */
public final class IntRuleSet implements RuleSet<Integer> {

    private static final IntRuleSet BASE = new IntRuleSet(ConstraintChain.root("IntRuleSet"), false, false, false);

    private static final double TOLERANCE = 1e-9;
    private static final Pattern INTEGRAL = Pattern.compile("[+-]?\\d+");
    private static final String TYPE_NAME = "int";

    private final ConstraintChain<Integer> chain;
    private final boolean strict;
    private final boolean required;
    private final boolean withNil;

    private IntRuleSet(ConstraintChain<Integer> chain, boolean strict, boolean required, boolean withNil) {
        this.chain = chain;
        this.strict = strict;
        this.required = required;
        this.withNil = withNil;
    }

    public static IntRuleSet integer() {
        return BASE;
    }

    @Override
    public boolean required() {
        return required;
    }

    /** Strings are no longer parsed. Lossless numeric conversions still apply. */
    public IntRuleSet withStrict() {
        return strict ? this : new IntRuleSet(chain.withLabel("WithStrict()"), true, required, withNil);
    }

    public IntRuleSet withRequired() {
        return required ? this : new IntRuleSet(chain.withLabel("WithRequired()"), strict, true, withNil);
    }

    public IntRuleSet withNil() {
        return withNil ? this : new IntRuleSet(chain.withLabel("WithNil()"), strict, required, true);
    }

    public IntRuleSet withRule(Rule<Integer> rule) {
        return new IntRuleSet(chain.withRule(rule), strict, required, withNil);
    }

    public IntRuleSet withRuleFunc(RuleFunc<Integer> fn) {
        return withRule(Rule.of(fn));
    }

    /** Inclusive minimum. Replaces any earlier minimum. */
    public IntRuleSet withMin(int min) {
        return withRule(new BoundRule(min, true));
    }

    /** Inclusive maximum. Replaces any earlier maximum. */
    public IntRuleSet withMax(int max) {
        return withRule(new BoundRule(max, false));
    }

    @Override
    public ValidationErrorCollection apply(RuleContext ctx, Object input, OutputRef<Integer> output) {
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

        Integer value;
        try {
            value = coerce(input);
        } catch (ArithmeticException e) {
            return ValidationErrorCollection.of(ValidationError.of(ErrorCode.RANGE, ctx, TYPE_NAME));
        }
        if (value == null) {
            return ValidationErrorCollection.of(ValidationError.of(ErrorCode.TYPE, ctx, TYPE_NAME, ValueKinds.of(input)));
        }

        ValidationErrorCollection errors = evaluate(ctx, value);
        if (errors.isEmpty()) {
            output.set(value);
        }
        return errors;
    }

    /**
     * @return the converted value, or {@code null} if the input has the wrong kind
     * @throws ArithmeticException if the input is integral but does not fit
     */
    private Integer coerce(Object input) {
        if (input instanceof Integer i) {
            return i;
        }
        if (input instanceof Short || input instanceof Byte) {
            return ((Number) input).intValue();
        }
        if (input instanceof Long l) {
            return Math.toIntExact(l);
        }
        if (input instanceof BigInteger big) {
            return big.intValueExact();
        }
        if (input instanceof BigDecimal dec) {
            return dec.stripTrailingZeros().scale() <= 0 ? dec.intValueExact() : null;
        }
        if (input instanceof Double || input instanceof Float) {
            double d = ((Number) input).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            double rounded = Math.rint(d);
            if (Math.abs(rounded - d) > TOLERANCE) {
                return null;
            }
            if (rounded < Integer.MIN_VALUE || rounded > Integer.MAX_VALUE) {
                throw new ArithmeticException("integer overflow");
            }
            return (int) rounded;
        }
        if (input instanceof String s && !strict) {
            try {
                return Integer.parseInt(s);
            } catch (NumberFormatException e) {
                if (INTEGRAL.matcher(s).matches()) {
                    throw new ArithmeticException("integer overflow: " + s);
                }
                return null;
            }
        }
        return null;
    }

    @Override
    public ValidationErrorCollection evaluate(RuleContext ctx, Integer value) {
        return chain.evaluate(ctx, value);
    }

    @Override
    public RuleSet<Object> any() {
        return WrapAny.of(this);
    }

    @Override
    public String describe() {
        return chain.describe();
    }

    @Override
    public String toString() {
        return describe();
    }

    private static final class BoundRule implements Rule<Integer> {
        private final int bound;
        private final boolean lower;

        BoundRule(int bound, boolean lower) {
            this.bound = bound;
            this.lower = lower;
        }

        @Override
        public ValidationErrorCollection evaluate(RuleContext ctx, Integer value) {
            if (lower && value < bound) {
                return ValidationErrorCollection.of(ValidationError.of(ErrorCode.MIN, ctx, bound));
            }
            if (!lower && value > bound) {
                return ValidationErrorCollection.of(ValidationError.of(ErrorCode.MAX, ctx, bound));
            }
            return ValidationErrorCollection.empty();
        }

        @Override
        public boolean conflictsWith(Rule<Integer> existing) {
            return existing instanceof BoundRule other && other.lower == lower;
        }

        @Override
        public String describe() {
            return (lower ? "WithMin(" : "WithMax(") + bound + ")";
        }
    }
}
