package io.rulekit.core.error;

/**
 * Thrown when registering a conditional key would close a cycle in the key
 * dependency graph.
 */
public final class CircularReferenceException extends RuleConfigurationException {

    private static final long serialVersionUID = 1L;

    private final String key;
    private final String dependsOn;

    public CircularReferenceException(String key, String dependsOn) {
        super("circular reference detected: " + key + " -> " + dependsOn);
        this.key = key;
        this.dependsOn = dependsOn;
    }

    /** The key whose conditional was being registered. */
    public String key() {
        return key;
    }

    /** The dependency whose edge closed the cycle. */
    public String dependsOn() {
        return dependsOn;
    }
}
