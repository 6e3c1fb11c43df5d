package io.rulekit.core.objects;

import io.rulekit.core.rules.ConstantRuleSet;
import io.rulekit.core.rules.Rule;
import io.rulekit.core.rules.RuleSet;

/**
 * Associates a key matcher with the rule set that validates the value, and
 * optionally a whole-record condition that must pass first.
 */
record FieldRule<T>(Rule<String> key, RuleSet<?> valueRuleSet, Conditional<T> condition) implements ObjectEntry<T> {

    /** The key for constant matchers, {@code null} for dynamic ones. */
    String constantKey() {
        return key instanceof ConstantRuleSet<String> constant ? constant.value() : null;
    }

    boolean isDynamic() {
        return !(key instanceof ConstantRuleSet<String>);
    }

    @Override
    public String describe() {
        String keyLabel = isDynamic() ? key.describe() : '"' + constantKey() + '"';
        if (condition != null) {
            String method = isDynamic() ? "WithConditionalDynamicKey" : "WithConditionalKey";
            return method + "(" + keyLabel + ", " + condition.describe() + ", " + valueRuleSet.describe() + ")";
        }
        return (isDynamic() ? "WithDynamicKey(" : "WithKey(") + keyLabel + ", " + valueRuleSet.describe() + ")";
    }
}
