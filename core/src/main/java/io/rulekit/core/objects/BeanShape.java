package io.rulekit.core.objects;

import io.rulekit.core.error.RuleConfigurationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Shape of a mutable bean, declared property by property.
 *
 * <pre>{@code
 * BeanShape<Person> shape = BeanShape.builder(Person.class, Person::new)
 *         .field("name", String.class, Person::getName, Person::setName)
 *         .field("age", Integer.class, Person::getAge, Person::setAge)
 *         .bucket("extras", Person::getExtras, Person::setExtras)
 *         .build();
 * }</pre>
 *
 * <p>
 * Values are cast to the declared property type when written; a value of the
 * wrong type fails with {@link ClassCastException}.
 *
 * @param <T> the bean type
 */
public final class BeanShape<T> implements ObjectShape<T> {

    private final Class<T> type;
    private final Supplier<T> factory;
    private final Map<String, Property<T, ?>> fields;
    private final Map<String, BucketProperty<T>> buckets;

    private BeanShape(Builder<T> builder) {
        this.type = builder.type;
        this.factory = builder.factory;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        this.buckets = Collections.unmodifiableMap(new LinkedHashMap<>(builder.buckets));
    }

    public static <T> Builder<T> builder(Class<T> type, Supplier<T> factory) {
        return new Builder<>(type, factory);
    }

    public Class<T> type() {
        return type;
    }

    /** Declared field names in declaration order. */
    public Collection<String> fieldNames() {
        return fields.keySet();
    }

    @Override
    public String typeName() {
        return type.getSimpleName();
    }

    @Override
    public T newInstance() {
        return Objects.requireNonNull(factory.get(), "factory returned null for " + type.getName());
    }

    @Override
    public boolean isMapShaped() {
        return false;
    }

    @Override
    public boolean isInstance(Object value) {
        return type.isInstance(value);
    }

    @Override
    public Setter setter(T target) {
        return new BeanSetter(target);
    }

    @Override
    public InputAccessor reader(T value) {
        return new BeanReader(value);
    }

    @Override
    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    @Override
    public boolean hasBucket(String name) {
        return buckets.containsKey(name);
    }

    // ── Properties ──

    private record Property<T, V>(String name, Class<V> valueType, Function<T, V> getter, BiConsumer<T, V> setter) {

        Object get(T target) {
            return getter.apply(target);
        }

        void set(T target, Object value) {
            setter.accept(target, valueType.cast(value));
        }
    }

    private record BucketProperty<T>(
            String name, Function<T, Map<String, Object>> getter, BiConsumer<T, Map<String, Object>> setter) {}

    private final class BeanSetter implements Setter {
        private final T target;

        BeanSetter(T target) {
            this.target = target;
        }

        @Override
        public void set(String key, Object value) {
            Property<T, ?> property = fields.get(key);
            if (property == null) {
                throw new IllegalStateException("no property \"" + key + "\" on " + typeName());
            }
            property.set(target, value);
        }

        @Override
        public void setInBucket(String bucket, String key, Object value) {
            BucketProperty<T> property = buckets.get(bucket);
            if (property == null) {
                throw new IllegalStateException("no bucket \"" + bucket + "\" on " + typeName());
            }
            Map<String, Object> map = property.getter().apply(target);
            if (map == null) {
                map = new LinkedHashMap<>();
                property.setter().accept(target, map);
            }
            map.put(key, value);
        }

        @Override
        public boolean isMapShaped() {
            return false;
        }
    }

    private final class BeanReader implements InputAccessor {
        private final T value;

        BeanReader(T value) {
            this.value = value;
        }

        @Override
        public boolean isMapShaped() {
            return false;
        }

        @Override
        public Collection<String> keys() {
            List<String> present = new ArrayList<>();
            for (Property<T, ?> property : fields.values()) {
                if (property.get(value) != null) {
                    present.add(property.name());
                }
            }
            return present;
        }

        @Override
        public boolean contains(String key) {
            return get(key) != null;
        }

        @Override
        public Object get(String key) {
            Property<T, ?> property = fields.get(key);
            return property != null ? property.get(value) : null;
        }
    }

    /** Builder for {@link BeanShape}. */
    public static final class Builder<T> {
        private final Class<T> type;
        private final Supplier<T> factory;
        private final Map<String, Property<T, ?>> fields = new LinkedHashMap<>();
        private final Map<String, BucketProperty<T>> buckets = new LinkedHashMap<>();

        private Builder(Class<T> type, Supplier<T> factory) {
            this.type = Objects.requireNonNull(type, "type must not be null");
            this.factory = Objects.requireNonNull(factory, "factory must not be null");
        }

        /**
         * Declares a field. Primitive properties must be declared with their
         * wrapper type, e.g. {@code Integer.class}.
         *
         * @throws RuleConfigurationException if the name is already declared
         */
        public <V> Builder<T> field(String name, Class<V> valueType, Function<T, V> getter, BiConsumer<T, V> setter) {
            checkUnique(name);
            fields.put(
                    name,
                    new Property<>(
                            name,
                            Objects.requireNonNull(valueType, "valueType must not be null"),
                            Objects.requireNonNull(getter, "getter must not be null"),
                            Objects.requireNonNull(setter, "setter must not be null")));
            return this;
        }

        /** Declares a bucket: a {@code Map<String, Object>} property that dynamic keys can be routed into. */
        public Builder<T> bucket(
                String name, Function<T, Map<String, Object>> getter, BiConsumer<T, Map<String, Object>> setter) {
            checkUnique(name);
            buckets.put(
                    name,
                    new BucketProperty<>(
                            name,
                            Objects.requireNonNull(getter, "getter must not be null"),
                            Objects.requireNonNull(setter, "setter must not be null")));
            return this;
        }

        private void checkUnique(String name) {
            Objects.requireNonNull(name, "name must not be null");
            if (fields.containsKey(name) || buckets.containsKey(name)) {
                throw new RuleConfigurationException("duplicate property \"" + name + "\" on " + type.getSimpleName());
            }
        }

        public BeanShape<T> build() {
            return new BeanShape<>(this);
        }
    }
}
