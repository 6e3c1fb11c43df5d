package io.rulekit.core.engine;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors for object rule set field tasks.
 *
 * <p>
 * Field tasks block on each other (same-field serialization and conditional
 * dependencies) and nested object rule sets join their own sub-tasks from
 * inside a task, so a bounded pool can deadlock. Both factories therefore
 * return unbounded cached pools of daemon threads.
 */
public final class EvaluationExecutors {

    /** Thread name prefix of the shared pool. */
    public static final String DEFAULT_THREAD_NAME_PREFIX = "rulekit-eval-";

    private EvaluationExecutors() {
        // utility class
    }

    /** The process-wide pool used by {@code RuleContext.background()}. Never shut down. */
    public static ExecutorService shared() {
        return SharedHolder.INSTANCE;
    }

    /**
     * Creates a new unbounded pool whose threads are named {@code prefix + n}.
     * The caller owns the pool and must shut it down.
     */
    public static ExecutorService newCachedPool(String threadNamePrefix) {
        return Executors.newCachedThreadPool(daemonThreadFactory(threadNamePrefix));
    }

    static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class SharedHolder {
        static final ExecutorService INSTANCE = newCachedPool(DEFAULT_THREAD_NAME_PREFIX);
    }
}
