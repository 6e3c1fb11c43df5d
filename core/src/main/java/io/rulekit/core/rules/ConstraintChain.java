package io.rulekit.core.rules;

import io.rulekit.core.error.ValidationErrorCollection;
import io.rulekit.core.model.RuleContext;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Persistent, backward-linked list of constraints that every rule set is built
 * from.
 *
 * <p>
 * A node holds either one {@link Rule} or a bare label (flags such as
 * {@code WithRequired()}), plus a link to its parent. Nodes are immutable;
 * extending a chain allocates one node and shares the whole parent chain.
 * Adding a rule first prunes every existing rule it {@linkplain
 * Rule#conflictsWith supersedes}, copying only the nodes between the head and
 * the deepest pruned node.
 *
 * @param <T> the value type of the rules
 */
public final class ConstraintChain<T> {

    private final ConstraintChain<T> parent;
    private final Rule<T> rule;
    private final String label;

    private ConstraintChain(ConstraintChain<T> parent, Rule<T> rule, String label) {
        this.parent = parent;
        this.rule = rule;
        this.label = label;
    }

    /** A root node carrying the rule set's base label, e.g. {@code StringRuleSet}. */
    public static <T> ConstraintChain<T> root(String label) {
        return new ConstraintChain<>(null, null, Objects.requireNonNull(label, "label must not be null"));
    }

    /** A parentless node holding {@code rule}. */
    public static <T> ConstraintChain<T> of(Rule<T> rule) {
        return new ConstraintChain<>(null, Objects.requireNonNull(rule, "rule must not be null"), null);
    }

    /**
     * Returns a new head holding {@code rule}, linked to this chain with every
     * rule that {@code rule} conflicts with removed.
     */
    public ConstraintChain<T> withRule(Rule<T> rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        return new ConstraintChain<>(withoutConflicts(rule), rule, null);
    }

    /** Returns a new head holding only a label. No conflict resolution. */
    public ConstraintChain<T> withLabel(String label) {
        return new ConstraintChain<>(this, null, Objects.requireNonNull(label, "label must not be null"));
    }

    /**
     * Returns this chain without the rules that {@code candidate} conflicts with.
     * Unchanged suffixes are shared, so when nothing conflicts the result is
     * {@code this}.
     *
     * @return the pruned chain, or {@code null} when every node was pruned
     */
    public ConstraintChain<T> withoutConflicts(Rule<T> candidate) {
        if (rule != null && candidate.conflictsWith(rule)) {
            return parent == null ? null : parent.withoutConflicts(candidate);
        }
        if (parent == null) {
            return this;
        }
        ConstraintChain<T> newParent = parent.withoutConflicts(candidate);
        if (newParent == parent) {
            return this;
        }
        return new ConstraintChain<>(newParent, rule, label);
    }

    /** Evaluates every rule, head first, and concatenates the errors. */
    public ValidationErrorCollection evaluate(RuleContext ctx, T value) {
        ValidationErrorCollection errors = ValidationErrorCollection.empty();
        for (ConstraintChain<T> node = this; node != null; node = node.parent) {
            if (node.rule != null) {
                errors = errors.concat(node.rule.evaluate(ctx, value));
            }
        }
        return errors;
    }

    /** Every rule in the chain, head first. Label nodes are skipped. */
    public List<Rule<T>> rules() {
        List<Rule<T>> rules = new ArrayList<>();
        for (ConstraintChain<T> node = this; node != null; node = node.parent) {
            if (node.rule != null) {
                rules.add(node.rule);
            }
        }
        return Collections.unmodifiableList(rules);
    }

    /** The enclosing chain, {@code null} at the root. */
    public ConstraintChain<T> parent() {
        return parent;
    }

    /** The rule of this node, {@code null} for label nodes. */
    public Rule<T> rule() {
        return rule;
    }

    /** Node labels joined with {@code .}, in the order they were added. */
    public String describe() {
        Deque<String> labels = new ArrayDeque<>();
        for (ConstraintChain<T> node = this; node != null; node = node.parent) {
            labels.push(node.label != null ? node.label : node.rule.describe());
        }
        return String.join(".", labels);
    }

    @Override
    public String toString() {
        return describe();
    }
}
