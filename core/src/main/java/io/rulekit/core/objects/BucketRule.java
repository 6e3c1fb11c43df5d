package io.rulekit.core.objects;

import io.rulekit.core.model.RuleContext;
import io.rulekit.core.rules.Rule;

/** Routes keys accepted by a matcher, and optionally a condition, into a named bucket. */
record BucketRule<T>(Rule<String> key, Conditional<T> condition, String bucket) implements ObjectEntry<T> {

    /**
     * True if {@code candidate} belongs in this bucket. The condition is
     * evaluated against {@code record}; callers must hold the output lock.
     */
    boolean accepts(RuleContext ctx, String candidate, T record) {
        return matches(ctx, candidate)
                && (condition == null || condition.evaluate(ctx, record).isEmpty());
    }

    @Override
    public String describe() {
        if (condition != null) {
            return "WithConditionalDynamicBucket(" + key.describe() + ", " + condition.describe() + ", \"" + bucket
                    + "\")";
        }
        return "WithDynamicBucket(" + key.describe() + ", \"" + bucket + "\")";
    }
}
