package io.rulekit.core.error;

/**
 * Thrown when a conditional rule depends on, or is attached to, a dynamic
 * (predicate) key. Only constant keys can take part in dependency ordering.
 */
public final class DynamicKeyConditionException extends RuleConfigurationException {

    private static final long serialVersionUID = 1L;

    public DynamicKeyConditionException(String keyDescription) {
        super("dynamic keys not supported in conditionals: " + keyDescription);
    }
}
