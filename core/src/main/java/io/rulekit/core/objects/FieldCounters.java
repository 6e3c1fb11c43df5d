package io.rulekit.core.objects;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Per-apply set of {@link FieldCounter}s keyed by field name. Thread-safe. */
final class FieldCounters {

    private final Map<String, FieldCounter> counters = new ConcurrentHashMap<>();

    void increment(String key) {
        counters.computeIfAbsent(key, FieldCounter::new).increment();
    }

    /** The counter for {@code key}, or {@code null} if no rule targets it. */
    FieldCounter get(String key) {
        return counters.get(key);
    }

    void release(String key) {
        FieldCounter counter = counters.get(key);
        if (counter != null) {
            counter.release();
        }
    }

    /** Waits for each key in turn. Keys without a counter are skipped. */
    void awaitSettled(Collection<String> keys) {
        for (String key : keys) {
            FieldCounter counter = counters.get(key);
            if (counter != null) {
                counter.awaitSettled();
            }
        }
    }
}
