package io.rulekit.core.model;

/**
 * Mutable holder that a rule set writes its coerced value into.
 *
 * <p>
 * A pre-populated holder is reused by object rule sets: fields that validate
 * successfully are overwritten, all others keep their previous values. Not
 * thread-safe; the object engine only hands it to one thread at a time.
 *
 * @param <T> the output type
 */
public final class OutputRef<T> {

    private T value;

    private OutputRef(T value) {
        this.value = value;
    }

    /** An empty holder. */
    public static <T> OutputRef<T> empty() {
        return new OutputRef<>(null);
    }

    /** A holder pre-populated with {@code value}. */
    public static <T> OutputRef<T> of(T value) {
        return new OutputRef<>(value);
    }

    public T get() {
        return value;
    }

    public void set(T value) {
        this.value = value;
    }

    public boolean isPresent() {
        return value != null;
    }

    @Override
    public String toString() {
        return "OutputRef[" + value + "]";
    }
}
