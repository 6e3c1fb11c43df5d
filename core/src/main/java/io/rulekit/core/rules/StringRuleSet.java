package io.rulekit.core.rules;

import io.rulekit.core.error.ErrorCode;
import io.rulekit.core.error.RuleConfigurationException;
import io.rulekit.core.error.ValidationError;
import io.rulekit.core.error.ValidationErrorCollection;
import io.rulekit.core.model.OutputRef;
import io.rulekit.core.model.RuleContext;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Rule set for strings. Numbers are coerced to their decimal text unless the
 * set is {@linkplain #withStrict() strict}.
 */
public final class StringRuleSet implements RuleSet<String> {

    private static final StringRuleSet BASE =
            new StringRuleSet(ConstraintChain.root("StringRuleSet"), false, false, false);

    private final ConstraintChain<String> chain;
    private final boolean strict;
    private final boolean required;
    private final boolean withNil;

    private StringRuleSet(ConstraintChain<String> chain, boolean strict, boolean required, boolean withNil) {
        this.chain = chain;
        this.strict = strict;
        this.required = required;
        this.withNil = withNil;
    }

    public static StringRuleSet string() {
        return BASE;
    }

    @Override
    public boolean required() {
        return required;
    }

    /** Only values that already are strings validate. */
    public StringRuleSet withStrict() {
        return strict ? this : new StringRuleSet(chain.withLabel("WithStrict()"), true, required, withNil);
    }

    public StringRuleSet withRequired() {
        return required ? this : new StringRuleSet(chain.withLabel("WithRequired()"), strict, true, withNil);
    }

    /** Null input validates and yields a null output. */
    public StringRuleSet withNil() {
        return withNil ? this : new StringRuleSet(chain.withLabel("WithNil()"), strict, required, true);
    }

    public StringRuleSet withRule(Rule<String> rule) {
        return new StringRuleSet(chain.withRule(rule), strict, required, withNil);
    }

    public StringRuleSet withRuleFunc(RuleFunc<String> fn) {
        return withRule(Rule.of(fn));
    }

    /** Minimum length in code points. Replaces any earlier minimum. */
    public StringRuleSet withMinLen(int min) {
        if (min < 0) {
            throw new RuleConfigurationException("minimum length must not be negative, got: " + min);
        }
        return withRule(new MinLenRule(min));
    }

    /** Maximum length in code points. Replaces any earlier maximum. */
    public StringRuleSet withMaxLen(int max) {
        if (max < 0) {
            throw new RuleConfigurationException("maximum length must not be negative, got: " + max);
        }
        return withRule(new MaxLenRule(max));
    }

    /**
     * Requires the value to contain a match for {@code regex}.
     *
     * @param message the error message used on mismatch
     * @throws RuleConfigurationException if the expression does not compile
     */
    public StringRuleSet withRegex(String regex, String message) {
        try {
            return withRegex(Pattern.compile(regex), message);
        } catch (PatternSyntaxException e) {
            throw new RuleConfigurationException("invalid regular expression: " + regex, e);
        }
    }

    public StringRuleSet withRegex(Pattern pattern, String message) {
        return withRule(new RegexRule(
                Objects.requireNonNull(pattern, "pattern must not be null"),
                Objects.requireNonNull(message, "message must not be null")));
    }

    /**
     * Restricts the value to a set of options. Calls are cumulative: the new
     * rule holds the union with any earlier allowed values and replaces the
     * earlier rule.
     */
    public StringRuleSet withAllowedValues(String value, String... rest) {
        TreeSet<String> values = valuesOf(value, rest);
        for (Rule<String> rule : chain.rules()) {
            if (rule instanceof ValuesRule existing && existing.allow) {
                values.addAll(Arrays.asList(existing.values));
                break;
            }
        }
        return withRule(new ValuesRule(values.toArray(new String[0]), true));
    }

    /** Rejects the given values, even if they are also allowed. */
    public StringRuleSet withRejectedValues(String value, String... rest) {
        return withRule(new ValuesRule(valuesOf(value, rest).toArray(new String[0]), false));
    }

    private static TreeSet<String> valuesOf(String value, String... rest) {
        TreeSet<String> values = new TreeSet<>();
        values.add(Objects.requireNonNull(value, "value must not be null"));
        for (String v : rest) {
            values.add(Objects.requireNonNull(v, "values must not contain null"));
        }
        return values;
    }

    @Override
    public ValidationErrorCollection apply(RuleContext ctx, Object input, OutputRef<String> output) {
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
        String str = coerce(input);
        if (str == null) {
            return ValidationErrorCollection.of(ValidationError.of(ErrorCode.TYPE, ctx, "string", ValueKinds.of(input)));
        }
        ValidationErrorCollection errors = evaluate(ctx, str);
        if (errors.isEmpty()) {
            output.set(str);
        }
        return errors;
    }

    private String coerce(Object input) {
        if (input instanceof String s) {
            return s;
        }
        if (strict) {
            return null;
        }
        if (input instanceof Integer || input instanceof Long || input instanceof Short || input instanceof Byte
                || input instanceof BigInteger || input instanceof BigDecimal) {
            return input.toString();
        }
        if (input instanceof Double || input instanceof Float) {
            double d = ((Number) input).doubleValue();
            if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return Double.toString(d);
        }
        return null;
    }

    @Override
    public ValidationErrorCollection evaluate(RuleContext ctx, String value) {
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

    // ── Rules ──

    private static final class MinLenRule implements Rule<String> {
        private final int min;

        MinLenRule(int min) {
            this.min = min;
        }

        @Override
        public ValidationErrorCollection evaluate(RuleContext ctx, String value) {
            if (value.codePointCount(0, value.length()) < min) {
                return ValidationErrorCollection.of(ValidationError.of(ErrorCode.MIN_LEN, ctx, min));
            }
            return ValidationErrorCollection.empty();
        }

        @Override
        public boolean conflictsWith(Rule<String> existing) {
            return existing instanceof MinLenRule;
        }

        @Override
        public String describe() {
            return "WithMinLen(" + min + ")";
        }
    }

    private static final class MaxLenRule implements Rule<String> {
        private final int max;

        MaxLenRule(int max) {
            this.max = max;
        }

        @Override
        public ValidationErrorCollection evaluate(RuleContext ctx, String value) {
            if (value.codePointCount(0, value.length()) > max) {
                return ValidationErrorCollection.of(ValidationError.of(ErrorCode.MAX_LEN, ctx, max));
            }
            return ValidationErrorCollection.empty();
        }

        @Override
        public boolean conflictsWith(Rule<String> existing) {
            return existing instanceof MaxLenRule;
        }

        @Override
        public String describe() {
            return "WithMaxLen(" + max + ")";
        }
    }

    private static final class RegexRule implements Rule<String> {
        private final Pattern pattern;
        private final String message;

        RegexRule(Pattern pattern, String message) {
            this.pattern = pattern;
            this.message = message;
        }

        @Override
        public ValidationErrorCollection evaluate(RuleContext ctx, String value) {
            if (!pattern.matcher(value).find()) {
                return ValidationErrorCollection.of(ValidationError.withMessage(ErrorCode.PATTERN, ctx, message));
            }
            return ValidationErrorCollection.empty();
        }

        @Override
        public String describe() {
            return "WithRegex(" + pattern.pattern() + ")";
        }
    }

    private static final class ValuesRule implements Rule<String> {
        // sorted for binary search
        private final String[] values;
        private final boolean allow;

        ValuesRule(String[] values, boolean allow) {
            this.values = values;
            this.allow = allow;
        }

        @Override
        public ValidationErrorCollection evaluate(RuleContext ctx, String value) {
            boolean exists = Arrays.binarySearch(values, value) >= 0;
            if (allow && !exists) {
                return ValidationErrorCollection.of(ValidationError.of(ErrorCode.NOT_ALLOWED, ctx));
            }
            if (!allow && exists) {
                return ValidationErrorCollection.of(ValidationError.of(ErrorCode.FORBIDDEN, ctx));
            }
            return ValidationErrorCollection.empty();
        }

        /** Allow lists replace earlier allow lists; reject lists accumulate. */
        @Override
        public boolean conflictsWith(Rule<String> existing) {
            return allow && existing instanceof ValuesRule other && other.allow;
        }

        @Override
        public String describe() {
            StringBuilder sb = new StringBuilder(allow ? "WithAllowedValues(" : "WithRejectedValues(");
            for (int i = 0; i < values.length; i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append('"').append(values[i]).append('"');
            }
            return sb.append(')').toString();
        }
    }
}
