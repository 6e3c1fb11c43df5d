package io.rulekit.core.objects;

import io.rulekit.core.error.ValidationErrorCollection;
import io.rulekit.core.model.RuleContext;
import io.rulekit.core.rules.Rule;

/**
 * A key-level entry in an object rule set's constraint chain. Entries are
 * dispatched per input key by {@link ObjectEvaluator}; they impose no
 * constraint on an assembled record, so {@link #evaluate} is always empty.
 */
sealed interface ObjectEntry<T> extends Rule<T> permits FieldRule, BucketRule {

    /** The key matcher. */
    Rule<String> key();

    @Override
    default ValidationErrorCollection evaluate(RuleContext ctx, T value) {
        return ValidationErrorCollection.empty();
    }

    /** True if {@code candidate} is accepted by the key matcher. */
    default boolean matches(RuleContext ctx, String candidate) {
        return key().evaluate(ctx, candidate).isEmpty();
    }
}
