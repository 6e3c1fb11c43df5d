package io.rulekit.core.objects;

import java.util.Collection;

/**
 * Read-only view of an input value as a set of named fields.
 *
 * <p>
 * Map-shaped inputs expose every key they hold and support dynamic key
 * matching. Record-shaped inputs expose only the properties their shape
 * declares, and a null property counts as absent.
 */
public interface InputAccessor {

    boolean isMapShaped();

    /** Present keys, in iteration order of the underlying value. */
    Collection<String> keys();

    boolean contains(String key);

    /** The value at {@code key}; {@code null} if absent or null. */
    Object get(String key);
}
