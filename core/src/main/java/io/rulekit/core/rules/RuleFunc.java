package io.rulekit.core.rules;

import io.rulekit.core.error.ValidationErrorCollection;
import io.rulekit.core.model.RuleContext;

/**
 * Functional form of {@link Rule#evaluate}. Wrap with {@link Rule#of} or pass
 * to a rule set's {@code withRuleFunc}. Returning {@code null} is treated as
 * "no errors".
 */
@FunctionalInterface
public interface RuleFunc<T> {

    ValidationErrorCollection evaluate(RuleContext ctx, T value);
}
