package io.rulekit.core.spi;

import io.rulekit.core.error.ValidationErrorCollection;

/**
 * Observability hook for {@link io.rulekit.core.engine.Validator} runs.
 *
 * <p>
 * Implementations bridge to metrics or tracing systems; the core has no
 * telemetry dependencies. Methods receive immutable events and must be
 * thread-safe and non-blocking. Exceptions thrown by a listener are logged by
 * the validator and never change a validation result.
 */
public interface ValidationListener {

    /** Called after a validation that produced no errors. */
    void onValidationCompleted(ValidationCompletedEvent event);

    /** Called after a validation that produced at least one error. */
    void onValidationFailed(ValidationFailedEvent event);

    // --- Event records ---

    /** @param ruleSet description of the applied rule set */
    record ValidationCompletedEvent(String ruleSet, long durationMs) {}

    /** @param internal true if any error was an internal one, such as a timeout */
    record ValidationFailedEvent(String ruleSet, long durationMs, ValidationErrorCollection errors, boolean internal) {

        public int errorCount() {
            return errors.size();
        }
    }
}
