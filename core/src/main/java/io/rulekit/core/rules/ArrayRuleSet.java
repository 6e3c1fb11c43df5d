package io.rulekit.core.rules;

import io.rulekit.core.error.ErrorCode;
import io.rulekit.core.error.ValidationError;
import io.rulekit.core.error.ValidationErrorCollection;
import io.rulekit.core.model.OutputRef;
import io.rulekit.core.model.RuleContext;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Rule set for lists. Accepts a {@link List} or a Java array (other than
 * {@code byte[]}) and produces an unmodifiable {@code List<T>}.
 *
 * <p>
 * Each element is applied to the item rule set in order, at the element's
 * index path, so a nested object error reads {@code /items/1/zip}. Without an
 * item rule set elements pass through unchanged. List-level rules such as
 * {@link #withMinLen} run after the items, even when some items failed.
 * Items are not started once the context is done.
 *
 * @param <T> the element type
 */
public final class ArrayRuleSet<T> implements RuleSet<List<T>> {

    private static final ArrayRuleSet<Object> BASE =
            new ArrayRuleSet<>(ConstraintChain.root("ArrayRuleSet"), null, false, false);

    private static final String TYPE_NAME = "list";

    private final ConstraintChain<List<T>> chain;
    private final RuleSet<T> items;
    private final boolean required;
    private final boolean withNil;

    private ArrayRuleSet(ConstraintChain<List<T>> chain, RuleSet<T> items, boolean required, boolean withNil) {
        this.chain = chain;
        this.items = items;
        this.required = required;
        this.withNil = withNil;
    }

    /** A list of untyped elements, passed through as-is. */
    public static ArrayRuleSet<Object> list() {
        return BASE;
    }

    /** A list whose elements are each applied to {@code items}. */
    public static <T> ArrayRuleSet<T> of(RuleSet<T> items) {
        return new ArrayRuleSet<T>(ConstraintChain.root("ArrayRuleSet"), null, false, false).withItemRuleSet(items);
    }

    /** The item rule set, {@code null} if elements pass through. */
    public RuleSet<T> items() {
        return items;
    }

    @Override
    public boolean required() {
        return required;
    }

    /** Replaces the item rule set. Only the most recent one is used. */
    public ArrayRuleSet<T> withItemRuleSet(RuleSet<T> items) {
        Objects.requireNonNull(items, "items must not be null");
        return new ArrayRuleSet<>(
                chain.withLabel("WithItemRuleSet(" + items.describe() + ")"), items, required, withNil);
    }

    public ArrayRuleSet<T> withRequired() {
        return required ? this : new ArrayRuleSet<>(chain.withLabel("WithRequired()"), items, true, withNil);
    }

    public ArrayRuleSet<T> withNil() {
        return withNil ? this : new ArrayRuleSet<>(chain.withLabel("WithNil()"), items, required, true);
    }

    public ArrayRuleSet<T> withRule(Rule<List<T>> rule) {
        return new ArrayRuleSet<>(chain.withRule(rule), items, required, withNil);
    }

    public ArrayRuleSet<T> withRuleFunc(RuleFunc<List<T>> fn) {
        return withRule(Rule.of(fn));
    }

    /** Minimum element count. Replaces any earlier minimum. */
    public ArrayRuleSet<T> withMinLen(int min) {
        return withRule(new LengthRule<>(min, true));
    }

    /** Maximum element count. Replaces any earlier maximum. */
    public ArrayRuleSet<T> withMaxLen(int max) {
        return withRule(new LengthRule<>(max, false));
    }

    @Override
    public ValidationErrorCollection apply(RuleContext ctx, Object input, OutputRef<List<T>> output) {
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

        List<?> elements = elements(input);
        if (elements == null) {
            return ValidationErrorCollection.of(ValidationError.of(ErrorCode.TYPE, ctx, TYPE_NAME, ValueKinds.of(input)));
        }

        List<T> values = new ArrayList<>(elements.size());
        ValidationErrorCollection errors = ValidationErrorCollection.empty();
        for (int i = 0; i < elements.size() && !ctx.isDone(); i++) {
            if (items == null) {
                @SuppressWarnings("unchecked")
                T value = (T) elements.get(i);
                values.add(value);
                continue;
            }
            OutputRef<T> item = OutputRef.empty();
            ValidationErrorCollection itemErrors = items.apply(ctx.withIndex(i), elements.get(i), item);
            if (itemErrors != null) {
                errors = errors.concat(itemErrors);
            }
            values.add(item.get());
        }

        List<T> result = Collections.unmodifiableList(values);
        if (!ctx.isDone()) {
            errors = errors.concat(chain.evaluate(ctx, result));
        }
        // nested object items report their own termination errors; keep one, here
        errors = errors.settle(ctx);
        if (errors.isEmpty()) {
            output.set(result);
        }
        return errors;
    }

    /** The elements of a list or array input, or {@code null} for any other kind. */
    private static List<?> elements(Object input) {
        if (input instanceof List<?> list) {
            return list;
        }
        if (input instanceof Object[] array) {
            return Arrays.asList(array);
        }
        if (input.getClass().isArray() && !(input instanceof byte[])) {
            int length = Array.getLength(input);
            List<Object> boxed = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                boxed.add(Array.get(input, i));
            }
            return boxed;
        }
        return null;
    }

    /** Applies every item and list rule to {@code value}. */
    @Override
    public ValidationErrorCollection evaluate(RuleContext ctx, List<T> value) {
        return apply(ctx, value, OutputRef.empty());
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

    private static final class LengthRule<T> implements Rule<List<T>> {
        private final int bound;
        private final boolean lower;

        LengthRule(int bound, boolean lower) {
            this.bound = bound;
            this.lower = lower;
        }

        @Override
        public ValidationErrorCollection evaluate(RuleContext ctx, List<T> value) {
            if (lower && value.size() < bound) {
                return ValidationErrorCollection.of(ValidationError.of(ErrorCode.MIN_LEN, ctx, bound));
            }
            if (!lower && value.size() > bound) {
                return ValidationErrorCollection.of(ValidationError.of(ErrorCode.MAX_LEN, ctx, bound));
            }
            return ValidationErrorCollection.empty();
        }

        @Override
        public boolean conflictsWith(Rule<List<T>> existing) {
            return existing instanceof LengthRule<?> other && other.lower == lower;
        }

        @Override
        public String describe() {
            return (lower ? "WithMinLen(" : "WithMaxLen(") + bound + ")";
        }
    }
}
