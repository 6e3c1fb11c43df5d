package io.rulekit.core.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared by every context derived from the
 * same root. Cancelling is idempotent and cannot be undone.
 *
 * <p>
 * Thread-safe.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "CancellationToken[cancelled=" + cancelled.get() + "]";
    }
}
