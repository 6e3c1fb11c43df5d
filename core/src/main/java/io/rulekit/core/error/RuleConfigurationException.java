package io.rulekit.core.error;

/**
 * Thrown when a rule set is built with an invalid configuration, for example
 * a key that the output shape does not declare or a negative length bound.
 * Subclasses cover the dependency-graph failures raised by conditional keys.
 */
public class RuleConfigurationException extends RuleException {

    private static final long serialVersionUID = 1L;

    public RuleConfigurationException(String message) {
        super(message, Phase.CONSTRUCTION);
    }

    public RuleConfigurationException(String message, Throwable cause) {
        super(message, cause, Phase.CONSTRUCTION);
    }
}
