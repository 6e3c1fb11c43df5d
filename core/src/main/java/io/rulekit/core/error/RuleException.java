package io.rulekit.core.error;

/**
 * Abstract base for all rulekit exceptions. Never thrown directly; use the
 * concrete subclasses.
 *
 * <p>
 * Construction-phase exceptions signal a defective schema and abort the
 * builder call that detected them. Evaluation-phase exceptions are only
 * thrown by the convenience {@code validate} methods; {@code apply} always
 * reports problems as a {@link ValidationErrorCollection}.
 */
public abstract class RuleException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        CONSTRUCTION,
        EVALUATION
    }

    private final Phase phase;

    protected RuleException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected RuleException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
