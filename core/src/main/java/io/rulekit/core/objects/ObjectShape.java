package io.rulekit.core.objects;

/**
 * Describes how to create, read and write one output type. Resolved once per
 * schema and shared by every apply.
 *
 * @param <T> the output type
 * @see MapShape
 * @see BeanShape
 */
public interface ObjectShape<T> {

    /** Short type name used in descriptions, e.g. {@code Map} or {@code Person}. */
    String typeName();

    T newInstance();

    /** True for map outputs, which accept any key and can receive unknown keys verbatim. */
    boolean isMapShaped();

    /** True if {@code value} can be read as a record of this shape. */
    boolean isInstance(Object value);

    Setter setter(T target);

    /** A read view of an instance of this shape. */
    InputAccessor reader(T value);

    /** True if the output can store a field named {@code name}. */
    boolean hasField(String name);

    /** True if the output has a bucket map named {@code name}. */
    boolean hasBucket(String name);
}
