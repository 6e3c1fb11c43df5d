package io.rulekit.core.objects;

/**
 * Writes validated values into an output record. Callers hold the output lock.
 *
 * <p>
 * Implementations throw {@link ClassCastException},
 * {@link IllegalStateException} or {@link UnsupportedOperationException} when
 * a value cannot be stored; the object engine reports those as
 * {@code INTERNAL} errors at the field path.
 */
public interface Setter {

    void set(String key, Object value);

    /** Stores {@code value} under {@code key} in the bucket map named {@code bucket}, creating it if absent. */
    void setInBucket(String bucket, String key, Object value);

    /** True if unknown keys can be copied straight into the output. */
    boolean isMapShaped();
}
