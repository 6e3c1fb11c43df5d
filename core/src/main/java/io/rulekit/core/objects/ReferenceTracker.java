package io.rulekit.core.objects;

import io.rulekit.core.error.CircularReferenceException;
import io.rulekit.core.error.DynamicKeyConditionException;
import io.rulekit.core.rules.ConstantRuleSet;
import io.rulekit.core.rules.Rule;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed dependency graph over constant keys. An edge {@code A -> B} means
 * A's conditional rule must not run until every rule on B has finished.
 *
 * <p>
 * Mutable and not thread-safe: it is only touched while a schema is being
 * built, and every derivation works on its own {@link #copy()}.
 */
final class ReferenceTracker {

    private final Map<String, List<String>> edges;

    ReferenceTracker() {
        this.edges = new LinkedHashMap<>();
    }

    private ReferenceTracker(Map<String, List<String>> edges) {
        this.edges = edges;
    }

    /**
     * Registers that {@code key} depends on {@code dependsOn}.
     *
     * @throws DynamicKeyConditionException if either side is not a constant key
     * @throws CircularReferenceException   if the edge closes a cycle
     */
    void add(Rule<String> key, Rule<String> dependsOn) {
        String from = constant(key);
        String to = constant(dependsOn);

        edges.computeIfAbsent(from, k -> new ArrayList<>()).add(to);

        if (hasCycle(from, new HashSet<>(), new HashSet<>())) {
            throw new CircularReferenceException(from, to);
        }
    }

    private static String constant(Rule<String> key) {
        if (key instanceof ConstantRuleSet<String> c) {
            return c.value();
        }
        throw new DynamicKeyConditionException(key.describe());
    }

    private boolean hasCycle(String node, Set<String> visited, Set<String> onStack) {
        if (onStack.contains(node)) {
            return true;
        }
        if (!visited.add(node)) {
            return false;
        }
        onStack.add(node);
        for (String child : edges.getOrDefault(node, List.of())) {
            if (hasCycle(child, visited, onStack)) {
                return true;
            }
        }
        onStack.remove(node);
        return false;
    }

    /** A deep copy; edits to either tracker never show up in the other. */
    ReferenceTracker copy() {
        Map<String, List<String>> clone = new LinkedHashMap<>();
        edges.forEach((k, v) -> clone.put(k, new ArrayList<>(v)));
        return new ReferenceTracker(clone);
    }

    @Override
    public String toString() {
        return "ReferenceTracker" + new HashMap<>(edges);
    }
}
