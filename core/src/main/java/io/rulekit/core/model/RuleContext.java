package io.rulekit.core.model;

import io.rulekit.core.engine.EvaluationExecutors;
import io.rulekit.core.error.PathSerializer;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Immutable per-evaluation context: the current field path, an optional
 * deadline, a cancellation token and the executor that object rule sets fan
 * their field tasks out on.
 *
 * <p>
 * Every {@code with*} method returns a new context sharing the parent's token,
 * deadline and executor. Contexts are cheap to derive and safe to hand to any
 * number of threads.
 */
public final class RuleContext {

    private static final long NO_DEADLINE = Long.MIN_VALUE;

    private final PathSegment path;
    private final long deadlineNanos;
    private final CancellationToken token;
    private final Executor executor;

    private RuleContext(PathSegment path, long deadlineNanos, CancellationToken token, Executor executor) {
        this.path = path;
        this.deadlineNanos = deadlineNanos;
        this.token = token;
        this.executor = executor;
    }

    /**
     * A root context with no deadline and a fresh cancellation token, running
     * field tasks on the shared default executor.
     */
    public static RuleContext background() {
        return new RuleContext(null, NO_DEADLINE, new CancellationToken(), EvaluationExecutors.shared());
    }

    /** The path of the value being evaluated, {@code null} at the root. */
    public PathSegment path() {
        return path;
    }

    public CancellationToken cancellationToken() {
        return token;
    }

    public Executor executor() {
        return executor;
    }

    /** A child context for the named field. */
    public RuleContext withPath(String key) {
        return new RuleContext(new PathSegment.Key(path, key), deadlineNanos, token, executor);
    }

    /** A child context for the list element at {@code index}. */
    public RuleContext withIndex(int index) {
        return new RuleContext(new PathSegment.Index(path, index), deadlineNanos, token, executor);
    }

    /**
     * Returns a context that times out {@code timeout} from now. A deadline
     * already set on this context is kept if it is earlier.
     *
     * @param timeout positive duration; zero or negative means "no new deadline"
     */
    public RuleContext withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            return this;
        }
        long candidate = System.nanoTime() + timeout.toNanos();
        if (deadlineNanos != NO_DEADLINE && deadlineNanos - candidate <= 0) {
            return this;
        }
        return new RuleContext(path, candidate, token, executor);
    }

    public RuleContext withCancellation(CancellationToken token) {
        return new RuleContext(path, deadlineNanos, Objects.requireNonNull(token, "token must not be null"), executor);
    }

    public RuleContext withExecutor(Executor executor) {
        return new RuleContext(path, deadlineNanos, token, Objects.requireNonNull(executor, "executor must not be null"));
    }

    public boolean hasDeadline() {
        return deadlineNanos != NO_DEADLINE;
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    public boolean isTimedOut() {
        return deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos >= 0;
    }

    /** True once the context is cancelled or past its deadline. */
    public boolean isDone() {
        return isCancelled() || isTimedOut();
    }

    @Override
    public String toString() {
        return "RuleContext[path=" + PathSerializer.DEFAULT.serialize(PathSegment.segments(path)) + ", done=" + isDone() + "]";
    }
}
