package io.rulekit.core.objects;

import io.rulekit.core.rules.Rule;
import java.util.List;

/**
 * A whole-record rule used as the condition of a conditional key or bucket.
 * The condition passes when {@link #evaluate} returns no errors; its errors
 * are never reported.
 *
 * <p>
 * {@link ObjectRuleSet} implements this interface out of the box.
 *
 * @param <T> the record type the condition inspects
 */
public interface Conditional<T> extends Rule<T> {

    /**
     * The keys the condition reads. A conditional key rule waits until every
     * rule on these keys has finished before evaluating the condition. Only
     * constant keys may be returned when the condition guards a key rule.
     */
    List<Rule<String>> keyRules();
}
