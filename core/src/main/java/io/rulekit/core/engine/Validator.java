package io.rulekit.core.engine;

import io.rulekit.core.config.ValidatorConfig;
import io.rulekit.core.error.ValidationErrorCollection;
import io.rulekit.core.model.CancellationToken;
import io.rulekit.core.model.OutputRef;
import io.rulekit.core.model.RuleContext;
import io.rulekit.core.model.ValidationResult;
import io.rulekit.core.rules.RuleSet;
import io.rulekit.core.spi.ValidationListener;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * Entry point for running rule sets with a configured deadline, executor and
 * error path format.
 *
 * <p>
 * Each call builds a fresh {@link RuleContext}, applies the rule set, logs a
 * {@code validation.completed} or {@code validation.failed} event with the
 * keys {@code rule_set}, {@code error_count} and {@code duration_ms}, and
 * notifies the optional {@link ValidationListener}.
 *
 * <p>
 * Thread-safe. The validator owns its evaluation pool; {@link #close()} shuts
 * it down.
 */
public final class Validator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Validator.class);

    private final ValidatorConfig config;
    private final ValidationListener listener;
    private final ExecutorService executor;
    private final AtomicBoolean closed = new AtomicBoolean();

    /** Creates a validator with {@link ValidatorConfig#DEFAULT} and no listener. */
    public Validator() {
        this(ValidatorConfig.DEFAULT, null);
    }

    public Validator(ValidatorConfig config) {
        this(config, null);
    }

    /**
     * @param config   validator settings
     * @param listener optional listener for validation outcomes, may be
     *                 {@code null}
     */
    public Validator(ValidatorConfig config, ValidationListener listener) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.listener = listener; // nullable
        this.executor = EvaluationExecutors.newCachedPool(config.threadNamePrefix());
    }

    public ValidatorConfig config() {
        return config;
    }

    /** Validates {@code input} against {@code ruleSet} without external cancellation. */
    public <T> ValidationResult<T> validate(RuleSet<T> ruleSet, Object input) {
        return validate(ruleSet, input, new CancellationToken());
    }

    /**
     * Validates {@code input} against {@code ruleSet}. Cancelling
     * {@code token} stops evaluation cooperatively; the result then carries a
     * {@code CANCELLED} error.
     *
     * @throws IllegalStateException if the validator has been closed
     */
    public <T> ValidationResult<T> validate(RuleSet<T> ruleSet, Object input, CancellationToken token) {
        Objects.requireNonNull(ruleSet, "ruleSet must not be null");
        Objects.requireNonNull(token, "token must not be null");
        if (closed.get()) {
            throw new IllegalStateException("Validator is closed");
        }

        RuleContext ctx = RuleContext.background().withExecutor(executor).withCancellation(token);
        if (config.hasTimeout()) {
            ctx = ctx.withTimeout(config.timeout());
        }

        long startNanos = System.nanoTime();
        OutputRef<T> output = OutputRef.empty();
        ValidationErrorCollection errors = ruleSet.apply(ctx, input, output);
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;

        String description = ruleSet.describe();
        if (errors == null || errors.isEmpty()) {
            LOG.atLevel(config.logResults() ? Level.INFO : Level.DEBUG)
                    .setMessage("validation.completed")
                    .addKeyValue("rule_set", description)
                    .addKeyValue("error_count", 0)
                    .addKeyValue("duration_ms", elapsedMs)
                    .log();
            notifyCompleted(description, elapsedMs);
            return ValidationResult.valid(output.get(), elapsedMs);
        }

        LOG.atLevel(config.logResults() || errors.isInternal() ? Level.INFO : Level.DEBUG)
                .setMessage("validation.failed")
                .addKeyValue("rule_set", description)
                .addKeyValue("error_count", errors.size())
                .addKeyValue("duration_ms", elapsedMs)
                .addKeyValue("errors", errors)
                .log();
        notifyFailed(description, elapsedMs, errors);
        return ValidationResult.invalid(errors, config.pathFormat().serializer(), elapsedMs);
    }

    /** Shuts down the evaluation pool. In-flight tasks run to completion. */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            executor.shutdown();
        }
    }

    // --- Listener notification helpers ---

    private void notifyCompleted(String ruleSet, long durationMs) {
        if (listener == null) return;
        try {
            listener.onValidationCompleted(new ValidationListener.ValidationCompletedEvent(ruleSet, durationMs));
        } catch (Exception e) {
            LOG.warn("ValidationListener.onValidationCompleted failed", e);
        }
    }

    private void notifyFailed(String ruleSet, long durationMs, ValidationErrorCollection errors) {
        if (listener == null) return;
        try {
            listener.onValidationFailed(
                    new ValidationListener.ValidationFailedEvent(ruleSet, durationMs, errors, errors.isInternal()));
        } catch (Exception e) {
            LOG.warn("ValidationListener.onValidationFailed failed", e);
        }
    }
}
