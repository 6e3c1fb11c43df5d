package io.rulekit.core.objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves an untyped input into an {@link InputAccessor}.
 *
 * <p>
 * Supported inputs, in order of precedence:
 * <ol>
 * <li>JSON text ({@code String} or {@code byte[]}) when pre-decoding is on; it
 * must decode to a JSON object</li>
 * <li>Jackson {@link ObjectNode}, converted to plain Java values</li>
 * <li>any {@link Map}; non-string keys are ignored</li>
 * <li>an instance of the target shape, read through its properties</li>
 * </ol>
 */
public final class InputAccessors {

    private static final Logger LOG = LoggerFactory.getLogger(InputAccessors.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private InputAccessors() {
        // utility class
    }

    /**
     * @param input the untyped input
     * @param shape the output shape; its instances are read as records
     * @param json  whether JSON text is decoded first
     * @return the accessor, or empty if the input cannot be read as an object
     */
    public static <T> Optional<InputAccessor> resolve(Object input, ObjectShape<T> shape, boolean json) {
        if (json && (input instanceof String || input instanceof byte[])) {
            return decodeJson(input).map(InputAccessors::ofMap);
        }
        if (input instanceof ObjectNode node) {
            return Optional.of(ofMap(MAPPER.convertValue(node, MAP_TYPE)));
        }
        if (input instanceof Map<?, ?> map) {
            return Optional.of(ofMap(map));
        }
        if (shape.isInstance(input)) {
            @SuppressWarnings("unchecked")
            T record = (T) input;
            return Optional.of(shape.reader(record));
        }
        return Optional.empty();
    }

    /** True if {@code input} would be offered to the JSON decoder. */
    static boolean isJsonCandidate(Object input) {
        return input instanceof String || input instanceof byte[];
    }

    private static Optional<Map<String, Object>> decodeJson(Object input) {
        try {
            Map<String, Object> decoded = input instanceof String s
                    ? MAPPER.readValue(s, MAP_TYPE)
                    : MAPPER.readValue((byte[]) input, MAP_TYPE);
            return Optional.ofNullable(decoded);
        } catch (JsonProcessingException e) {
            LOG.debug("Input is not a JSON object: {}", e.getOriginalMessage());
            return Optional.empty();
        } catch (IOException e) {
            LOG.debug("Failed to read JSON input: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /** A map-shaped accessor over {@code map}. */
    public static InputAccessor ofMap(Map<?, ?> map) {
        return new MapInput(map);
    }

    private static final class MapInput implements InputAccessor {
        private final Map<?, ?> map;

        MapInput(Map<?, ?> map) {
            this.map = map;
        }

        @Override
        public boolean isMapShaped() {
            return true;
        }

        @Override
        public Collection<String> keys() {
            List<String> keys = new ArrayList<>(map.size());
            for (Object key : map.keySet()) {
                if (key instanceof String s) {
                    keys.add(s);
                }
            }
            return keys;
        }

        @Override
        public boolean contains(String key) {
            return map.containsKey(key);
        }

        @Override
        public Object get(String key) {
            return map.get(key);
        }
    }
}
