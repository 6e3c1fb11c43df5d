package io.rulekit.core.objects;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shape of {@code Map<String, Object>} outputs. New outputs are
 * {@link LinkedHashMap}s; bucket maps are created on first write.
 */
public final class MapShape implements ObjectShape<Map<String, Object>> {

    public static final MapShape INSTANCE = new MapShape();

    private MapShape() {}

    @Override
    public String typeName() {
        return "Map";
    }

    @Override
    public Map<String, Object> newInstance() {
        return new LinkedHashMap<>();
    }

    @Override
    public boolean isMapShaped() {
        return true;
    }

    @Override
    public boolean isInstance(Object value) {
        return value instanceof Map;
    }

    @Override
    public Setter setter(Map<String, Object> target) {
        return new MapSetter(target);
    }

    @Override
    public InputAccessor reader(Map<String, Object> value) {
        return InputAccessors.ofMap(value);
    }

    @Override
    public boolean hasField(String name) {
        return true;
    }

    @Override
    public boolean hasBucket(String name) {
        return true;
    }

    private static final class MapSetter implements Setter {
        private final Map<String, Object> target;

        MapSetter(Map<String, Object> target) {
            this.target = target;
        }

        @Override
        public void set(String key, Object value) {
            target.put(key, value);
        }

        @Override
        @SuppressWarnings("unchecked")
        public void setInBucket(String bucket, String key, Object value) {
            Object existing = target.get(bucket);
            if (existing == null) {
                Map<String, Object> created = new LinkedHashMap<>();
                created.put(key, value);
                target.put(bucket, created);
            } else if (existing instanceof Map<?, ?> map) {
                ((Map<String, Object>) map).put(key, value);
            } else {
                throw new IllegalStateException(
                        "bucket \"" + bucket + "\" already holds a non-map value of type "
                                + existing.getClass().getSimpleName());
            }
        }

        @Override
        public boolean isMapShaped() {
            return true;
        }
    }
}
